package com.belgraph.compiler.session;

import com.belgraph.compiler.definition.DefinitionModels.Definition;
import com.belgraph.compiler.graph.BelGraph;
import com.belgraph.compiler.problem.ParseProblem;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** When {@code complete} is false the graph holds what was built before the fatal line. */
public record CompilationResult(BelGraph graph,
                                Map<String, String> metadata,
                                List<Definition> definitions,
                                boolean complete,
                                int linesProcessed,
                                int statementsProcessed,
                                List<ParseProblem> warnings,
                                List<ParseProblem> errors,
                                ParseProblem fatal,
                                int excludedStatements) {
    public CompilationResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        definitions = List.copyOf(definitions);
        warnings = List.copyOf(warnings);
        errors = List.copyOf(errors);
    }

    public String name() {
        return metadata.get("Name");
    }

    public String version() {
        return metadata.get("Version");
    }
}
