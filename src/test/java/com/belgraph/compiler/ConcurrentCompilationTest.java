package com.belgraph.compiler;

import com.belgraph.compiler.config.CompilerSettings;
import com.belgraph.compiler.graph.GraphModels.Node;
import com.belgraph.compiler.problem.ParseProblem;
import com.belgraph.compiler.session.BelCompiler;
import com.belgraph.compiler.session.CompilationResult;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrentCompilationTest {
    private static final String HEADER = """
            SET DOCUMENT Name = "Concurrent %d"
            SET DOCUMENT Version = "1.0"
            DEFINE NAMESPACE HGNC AS URL "classpath:definitions/hgnc.belns"
            SET Citation = {"PubMed", "Some Journal", "%d"}
            """;

    private static final List<String> DOCUMENTS = List.of(
            HEADER.formatted(1, 101) + """
                    SET Evidence = "AKT1 increases JUN"
                    p(HGNC:AKT1) -> p(HGNC:JUN)
                    p(HGNC:JUN) -> bp(GOBP:apoptosis)
                    complex(p(HGNC:AKT1), p(HGNC:MAPK1)) -> p(HGNC:TP53)
                    """,
            HEADER.formatted(2, 202) + """
                    SET Evidence = "legacy activities"
                    kin(p(HGNC:MAPK1)) -> p(HGNC:JUN)
                    p(HGNC:NOTAGENE) -> p(HGNC:JUN)
                    p(HGNC:TP53) -| bp(GOBP:apoptosis)
                    """,
            HEADER.formatted(3, 303) + """
                    SET Evidence = "mixed"
                    act(p(HGNC:CFTR)) -> deg(p(HGNC:YFG))
                    complex(act(p(HGNC:AKT1)), p(HGNC:JUN)) -> p(HGNC:TP53)
                    p(UNDEFINED:X) -> p(HGNC:AKT1)
                    tloc(p(HGNC:JUN), fromLoc(GOCC:cytoplasm), toLoc(GOCC:nucleus)) -> p(HGNC:TP53)
                    """);

    private final BelCompiler compiler = BelCompiler.standalone(CompilerSettings.defaults());

    private static List<String> summary(CompilationResult result) {
        List<String> lines = new ArrayList<>();
        result.graph().nodes().stream().map(Node::bel).sorted().forEach(bel -> lines.add("node " + bel));
        result.graph().edges().forEach(e -> lines.add("edge " + e.subject() + " " + e.relation() + " " + e.object()
                + " " + e.line() + " " + e.subjectSide().describe() + " " + e.objectSide().describe()));
        result.warnings().forEach(p -> lines.add("warning " + describe(p)));
        result.errors().forEach(p -> lines.add("error " + describe(p)));
        lines.add("excluded " + result.excludedStatements());
        return lines;
    }

    private static String describe(ParseProblem problem) {
        return problem.code() + "@" + problem.lineNumber();
    }

    @Test
    void parallelCompilesMatchSequentialOnes() throws Exception {
        List<List<String>> expected = DOCUMENTS.stream().map(compiler::compile).map(ConcurrentCompilationTest::summary).toList();
        assertTrue(expected.get(1).stream().anyMatch(l -> l.startsWith("warning")));
        assertTrue(expected.get(2).stream().anyMatch(l -> l.startsWith("error")));

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<List<String>>> tasks = new ArrayList<>();
            for (int round = 0; round < 8; round++) {
                for (String document : DOCUMENTS) {
                    tasks.add(() -> summary(compiler.compile(document)));
                }
            }
            List<Future<List<String>>> futures = pool.invokeAll(tasks);
            for (int i = 0; i < futures.size(); i++) {
                assertEquals(expected.get(i % DOCUMENTS.size()), futures.get(i).get(30, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdown();
        }
    }
}
