package com.belgraph.compiler.parser;

import com.belgraph.compiler.term.Relation;
import com.belgraph.compiler.term.TermModels.Term;

import java.util.List;

public class StatementModels {
    public sealed interface Statement permits DocumentStatement, DefineStatement, SetStatement, UnsetStatement,
            UnsetAllStatement, RelationStatement, TermStatement {
        /** Header statements may only appear before the first other statement. */
        default boolean isHeader() {
            return false;
        }
    }

    public enum DefinitionType { NAMESPACE, ANNOTATION }

    public enum DefinitionSource { URL, LIST, PATTERN }

    public record DocumentStatement(String key, String value) implements Statement {
        @Override
        public boolean isHeader() {
            return true;
        }
    }

    /** {@code location} is set for URL and PATTERN sources, {@code values} for LIST sources. */
    public record DefineStatement(DefinitionType type, String name, DefinitionSource source,
                                  String location, List<String> values) implements Statement {
        public DefineStatement {
            values = values == null ? List.of() : List.copyOf(values);
        }

        @Override
        public boolean isHeader() {
            return true;
        }
    }

    /** {@code braced} tells {@code SET k = {"a"}} apart from {@code SET k = "a"}; citations need the braces. */
    public record SetStatement(String key, List<String> values, boolean braced) implements Statement {
        public SetStatement {
            values = List.copyOf(values);
        }
    }

    public record UnsetStatement(List<String> keys) implements Statement {
        public UnsetStatement {
            keys = List.copyOf(keys);
        }
    }

    public record UnsetAllStatement() implements Statement {}

    public record RelationStatement(Term subject, Relation relation, Term object) implements Statement {}

    public record TermStatement(Term term) implements Statement {}
}
