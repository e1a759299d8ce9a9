package com.belgraph.compiler.definition;

import com.belgraph.compiler.definition.DefinitionModels.*;
import com.belgraph.compiler.parser.StatementModels.DefineStatement;
import com.belgraph.compiler.parser.StatementModels.DefinitionSource;
import com.belgraph.compiler.parser.StatementModels.DefinitionType;
import com.belgraph.compiler.problem.BelStatementException;
import com.belgraph.compiler.problem.DefinitionPlacementException;
import com.belgraph.compiler.problem.ProblemCode;

import java.util.*;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public class DefinitionRegistry {
    private final DefinitionResolver resolver;
    private final Map<DefinitionType, Map<String, Definition>> declared = new EnumMap<>(DefinitionType.class);
    private final Map<DefinitionType, Map<String, ValueSet>> resolved = new EnumMap<>(DefinitionType.class);

    public DefinitionRegistry(DefinitionResolver resolver) {
        this.resolver = resolver;
        for (DefinitionType type : DefinitionType.values()) {
            declared.put(type, new LinkedHashMap<>());
            resolved.put(type, new HashMap<>());
        }
    }

    public void declare(DefineStatement statement) {
        Map<String, Definition> byName = declared.get(statement.type());
        if (byName.containsKey(statement.name())) {
            throw new DefinitionPlacementException(ProblemCode.DUPLICATE_DEFINITION,
                    statement.type().name().toLowerCase() + " " + statement.name());
        }
        Definition definition = new Definition(statement.type(), statement.name(), statement.source(),
                statement.location(), statement.values());
        switch (statement.source()) {
            case LIST -> resolved.get(statement.type()).put(statement.name(), new ListValueSet(new HashSet<>(statement.values())));
            case PATTERN -> resolved.get(statement.type()).put(statement.name(), new PatternValueSet(compile(statement.location())));
            case URL -> { }
        }
        byName.put(statement.name(), definition);
    }

    public boolean isDefined(DefinitionType type, String name) {
        return declared.get(type).containsKey(name);
    }

    /**
     * Value set of a declared definition, resolving it first if needed.
     *
     * @throws DefinitionResolutionException when a URL definition cannot be resolved
     */
    public Optional<ValueSet> valueSet(DefinitionType type, String name) {
        Definition definition = declared.get(type).get(name);
        if (definition == null) return Optional.empty();
        ValueSet values = resolved.get(type).get(name);
        if (values == null && definition.source() == DefinitionSource.URL) {
            values = new ListValueSet(resolver.resolve(definition.location()));
            resolved.get(type).put(name, values);
        }
        return Optional.ofNullable(values);
    }

    public List<Definition> definitions() {
        List<Definition> all = new ArrayList<>();
        declared.values().forEach(byName -> all.addAll(byName.values()));
        return all;
    }

    private static Pattern compile(String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new BelStatementException(ProblemCode.GENERAL_PARSER_FAILURE, "invalid pattern " + regex);
        }
    }
}
