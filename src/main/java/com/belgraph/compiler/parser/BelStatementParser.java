package com.belgraph.compiler.parser;

import com.belgraph.compiler.problem.BelStatementException;
import com.belgraph.compiler.problem.ProblemCode;
import com.belgraph.compiler.term.Relation;
import com.belgraph.compiler.term.TermModels.Term;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.belgraph.compiler.parser.StatementModels.*;

@Component
public class BelStatementParser {
    private static final Pattern DOCUMENT_PATTERN = Pattern.compile("^SET\\s+DOCUMENT\\s+(\\w+)\\s*=\\s*(.+)$");
    private static final Pattern DEFINE_PATTERN = Pattern.compile("^DEFINE\\s+(NAMESPACE|ANNOTATION)\\s+(\\S+)\\s+AS\\s+(URL|LIST|PATTERN)\\s+(.+)$");
    private static final Pattern SET_PATTERN = Pattern.compile("^SET\\s+([^\\s=]+)\\s*=\\s*(.+)$");
    private static final Pattern UNSET_ALL_PATTERN = Pattern.compile("^UNSET\\s+ALL$");
    private static final Pattern UNSET_PATTERN = Pattern.compile("^UNSET\\s+(.+)$");
    private static final Pattern TERM_START = Pattern.compile("^[A-Za-z][A-Za-z0-9]*\\s*\\(");

    public Statement parse(String line) {
        String trimmed = line.strip();

        Matcher m = DOCUMENT_PATTERN.matcher(trimmed);
        if (m.matches()) {
            return new DocumentStatement(m.group(1), single(values(m.group(2))));
        }
        if (trimmed.startsWith("DEFINE")) {
            return parseDefine(trimmed);
        }
        if (UNSET_ALL_PATTERN.matcher(trimmed).matches()) {
            return new UnsetAllStatement();
        }
        m = UNSET_PATTERN.matcher(trimmed);
        if (m.matches()) {
            return new UnsetStatement(values(m.group(1)).values());
        }
        m = SET_PATTERN.matcher(trimmed);
        if (m.matches()) {
            ValueList values = values(m.group(2));
            return new SetStatement(m.group(1), values.values(), values.braced());
        }
        if (trimmed.startsWith("SET ")) {
            throw failure();
        }
        return parseRelation(trimmed);
    }

    private Statement parseDefine(String line) {
        Matcher m = DEFINE_PATTERN.matcher(line);
        if (!m.matches()) throw failure();
        DefinitionType type = DefinitionType.valueOf(m.group(1));
        DefinitionSource source = DefinitionSource.valueOf(m.group(3));
        ValueList values = values(m.group(4));
        if (source == DefinitionSource.LIST) {
            if (!values.braced()) throw failure();
            return new DefineStatement(type, m.group(2), source, null, values.values());
        }
        return new DefineStatement(type, m.group(2), source, single(values), List.of());
    }

    private Statement parseRelation(String line) {
        if (!TERM_START.matcher(line).find()) throw failure();

        BelTermParser subjectParser = new BelTermParser(line, 0);
        Term subject = subjectParser.parseTerm();
        int pos = skipWhitespace(line, subjectParser.position());
        if (pos >= line.length()) {
            return new TermStatement(subject);
        }

        int relationEnd = pos;
        Relation relation = null;
        for (String symbol : Relation.symbols()) {
            if (line.startsWith(symbol, pos)) {
                relation = Relation.fromKeyword(symbol).orElseThrow();
                relationEnd = pos + symbol.length();
                break;
            }
        }
        if (relation == null) {
            while (relationEnd < line.length() && Character.isLetter(line.charAt(relationEnd))) relationEnd++;
            String word = line.substring(pos, relationEnd);
            Optional<Relation> found = Relation.fromKeyword(word);
            if (found.isEmpty()) {
                throw new BelStatementException(ProblemCode.GENERAL_PARSER_FAILURE, "unknown relation '" + word + "'");
            }
            relation = found.get();
        }

        int objectStart = skipWhitespace(line, relationEnd);
        if (objectStart < line.length() && line.charAt(objectStart) == '(') {
            throw new BelStatementException(ProblemCode.NESTED_RELATION, line.substring(objectStart));
        }
        BelTermParser objectParser = new BelTermParser(line, objectStart);
        Term object = objectParser.parseTerm();
        if (skipWhitespace(line, objectParser.position()) < line.length()) {
            throw new BelStatementException(ProblemCode.GENERAL_PARSER_FAILURE,
                    "unexpected text after object: " + line.substring(objectParser.position()).strip());
        }
        return new RelationStatement(subject, relation, object);
    }

    private static int skipWhitespace(String line, int pos) {
        while (pos < line.length() && Character.isWhitespace(line.charAt(pos))) pos++;
        return pos;
    }

    private static BelStatementException failure() {
        return new BelStatementException(ProblemCode.GENERAL_PARSER_FAILURE, null);
    }

    private static String single(ValueList values) {
        if (values.braced() || values.values().size() != 1) {
            throw new BelStatementException(ProblemCode.GENERAL_PARSER_FAILURE, "expected a single value");
        }
        return values.values().get(0);
    }

    /** Reads {@code "a"}, {@code a} or {@code {"a", b, "c"}}. */
    static ValueList values(String raw) {
        String text = raw.strip();
        boolean braced = text.startsWith("{");
        if (braced) {
            if (!text.endsWith("}")) throw failure();
            text = text.substring(1, text.length() - 1).strip();
        }
        List<String> values = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            i = skipWhitespace(text, i);
            if (i >= text.length()) break;
            StringBuilder value = new StringBuilder();
            boolean quoted = text.charAt(i) == '"';
            if (quoted) {
                i++;
                boolean closed = false;
                while (i < text.length()) {
                    char c = text.charAt(i++);
                    if (c == '\\' && i < text.length()) {
                        value.append(text.charAt(i++));
                    } else if (c == '"') {
                        closed = true;
                        break;
                    } else {
                        value.append(c);
                    }
                }
                if (!closed) throw failure();
            } else {
                int start = i;
                while (i < text.length() && text.charAt(i) != ',') i++;
                value.append(text, start, i);
                if (!braced && value.toString().strip().contains(" ")) throw failure();
            }
            values.add(quoted ? value.toString() : value.toString().strip());
            i = skipWhitespace(text, i);
            if (i < text.length()) {
                if (text.charAt(i) != ',' || !braced) throw failure();
                i++;
            }
        }
        if (values.isEmpty()) throw failure();
        return new ValueList(values, braced);
    }

    record ValueList(List<String> values, boolean braced) {}
}
