package com.belgraph.compiler.service;

import com.belgraph.compiler.problem.ParseProblem;
import com.belgraph.compiler.session.BelCompiler;
import com.belgraph.compiler.session.CompilationResult;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class DocumentCompileService {
    private final BelCompiler compiler;
    private final StoredGraphService graphService;

    public DocumentCompileService(BelCompiler compiler, StoredGraphService graphService) {
        this.compiler = compiler;
        this.graphService = graphService;
    }

    public CompileSummary compile(String content, boolean dryRun) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Document content is empty");
        }
        CompilationResult result = compiler.compile(content);

        boolean storable = result.complete() && result.name() != null && result.version() != null;
        if (storable && !dryRun) {
            graphService.store(result);
        }
        return new CompileSummary(dryRun, result.complete(), storable && !dryRun,
                result.name(), result.version(), result.metadata(),
                result.linesProcessed(), result.statementsProcessed(),
                result.graph().nodeCount(), result.graph().edgeCount(), result.excludedStatements(),
                result.warnings().stream().map(ProblemView::of).toList(),
                result.errors().stream().map(ProblemView::of).toList(),
                result.fatal() == null ? null : ProblemView.of(result.fatal()));
    }

    public record ProblemView(int code, String severity, String name, int line, String message, String text) {
        static ProblemView of(ParseProblem problem) {
            return new ProblemView(problem.code().code(), problem.severity().name(), problem.code().name(),
                    problem.lineNumber(), problem.describe(), problem.line());
        }
    }

    public record CompileSummary(boolean dryRun,
                                 boolean complete,
                                 boolean stored,
                                 String name,
                                 String version,
                                 Map<String, String> metadata,
                                 int linesProcessed,
                                 int statementsProcessed,
                                 int nodeCount,
                                 int edgeCount,
                                 int excludedStatements,
                                 List<ProblemView> warnings,
                                 List<ProblemView> errors,
                                 ProblemView fatal) {
    }
}
