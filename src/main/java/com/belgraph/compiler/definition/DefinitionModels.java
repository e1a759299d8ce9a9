package com.belgraph.compiler.definition;

import com.belgraph.compiler.parser.StatementModels.DefinitionSource;
import com.belgraph.compiler.parser.StatementModels.DefinitionType;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

public class DefinitionModels {
    public sealed interface ValueSet permits ListValueSet, PatternValueSet {
        boolean contains(String value);
    }

    public record ListValueSet(Set<String> values) implements ValueSet {
        public ListValueSet {
            values = Set.copyOf(values);
        }

        @Override
        public boolean contains(String value) {
            return values.contains(value);
        }
    }

    public record PatternValueSet(Pattern pattern) implements ValueSet {
        @Override
        public boolean contains(String value) {
            return pattern.matcher(value).matches();
        }
    }

    public record Definition(DefinitionType type, String name, DefinitionSource source, String location, List<String> values) {
        public Definition {
            values = values == null ? List.of() : List.copyOf(values);
        }
    }
}
