package com.belgraph.compiler.session;

import com.belgraph.compiler.config.CompilerSettings;
import com.belgraph.compiler.context.AnnotationContext;
import com.belgraph.compiler.context.ContextModels.ContextSnapshot;
import com.belgraph.compiler.definition.DefinitionRegistry;
import com.belgraph.compiler.definition.DefinitionResolutionException;
import com.belgraph.compiler.definition.DefinitionResolver;
import com.belgraph.compiler.graph.GraphBuilder;
import com.belgraph.compiler.graph.GraphBuilder.Endpoint;
import com.belgraph.compiler.graph.GraphModels.NodeId;
import com.belgraph.compiler.normalize.TermNormalizer;
import com.belgraph.compiler.normalize.TermNormalizer.Correction;
import com.belgraph.compiler.normalize.TermNormalizer.NormalizedTerm;
import com.belgraph.compiler.parser.BelStatementParser;
import com.belgraph.compiler.parser.LineAssembler;
import com.belgraph.compiler.parser.LineAssembler.LogicalLine;
import com.belgraph.compiler.problem.*;
import com.belgraph.compiler.term.TermModels.MemberList;
import com.belgraph.compiler.term.TermModels.Term;
import com.belgraph.compiler.validation.IdentifierValidator;
import com.belgraph.compiler.validation.SemanticValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static com.belgraph.compiler.parser.StatementModels.*;

/** Not thread-safe: one session per document. */
public class CompilationSession {
    private static final Logger log = LoggerFactory.getLogger(CompilationSession.class);

    private final CompilerSettings settings;
    private final BelStatementParser parser;
    private final LineAssembler assembler = new LineAssembler();
    private final ProblemLog problems = new ProblemLog();
    private final DefinitionRegistry definitions;
    private final AnnotationContext context;
    private final TermNormalizer normalizer;
    private final IdentifierValidator identifiers;
    private final SemanticValidator validator = new SemanticValidator();
    private final GraphBuilder builder;
    private final Map<String, String> metadata = new LinkedHashMap<>();
    private final long startedAt = System.nanoTime();

    private boolean headerSealed;
    private boolean aborted;

    public CompilationSession(CompilerSettings settings, DefinitionResolver resolver, BelStatementParser parser) {
        this.settings = settings;
        this.parser = parser;
        this.definitions = new DefinitionRegistry(resolver);
        this.context = new AnnotationContext(definitions, settings.strictAnnotations());
        this.normalizer = new TermNormalizer(settings.modifierPolicy());
        this.identifiers = new IdentifierValidator(definitions, settings.strictNamespaces());
        this.builder = new GraphBuilder(settings.completeOrigin());
    }

    /**
     * Feeds one physical line.
     *
     * @throws FatalCompilationException when the document cannot be compiled any further
     */
    public void accept(String physicalLine) {
        if (aborted) throw new IllegalStateException("Session was aborted by a fatal problem");
        assembler.accept(physicalLine).ifPresent(this::process);
    }

    /**
     * Flushes a pending continuation line and returns the result.
     *
     * @throws FatalCompilationException when the flushed line is fatal
     */
    public CompilationResult finish() {
        if (!aborted) {
            assembler.finish().ifPresent(this::process);
        }
        CompilationResult result = result();
        log.info("Compiled {} in {} ms: {} nodes, {} edges, {} warnings, {} errors{}",
                result.name() == null ? "document" : result.name(),
                (System.nanoTime() - startedAt) / 1_000_000,
                result.graph().nodeCount(), result.graph().edgeCount(),
                result.warnings().size(), result.errors().size(),
                result.complete() ? "" : ", aborted");
        return result;
    }

    /** State so far, also readable after a fatal problem. */
    public CompilationResult result() {
        return new CompilationResult(builder.graph(), metadata, definitions.definitions(), !aborted,
                assembler.physicalLines(), problems.statementsProcessed(), problems.warnings(), problems.errors(),
                problems.fatal(), problems.excludedStatements());
    }

    private void process(LogicalLine line) {
        problems.statementProcessed();
        List<Correction> corrections = new ArrayList<>();
        try {
            handle(parser.parse(line.text()), line, corrections);
            corrections.forEach(c -> problems.report(line.text(), line.lineNumber(), c.code(), c.detail()));
        } catch (BelStatementException e) {
            problems.report(line.text(), line.lineNumber(), e.code(), e.detail());
            problems.statementExcluded();
        } catch (DefinitionResolutionException e) {
            throw fatal(line, ProblemCode.UNRESOLVED_DEFINITION, e.getMessage(), e);
        }
    }

    private void handle(Statement statement, LogicalLine line, List<Correction> corrections) {
        if (statement.isHeader()) {
            if (headerSealed) {
                throw new DefinitionPlacementException(ProblemCode.MISPLACED_DEFINITION, line.text());
            }
            if (statement instanceof DocumentStatement document) {
                metadata.put(document.key(), document.value());
            } else if (statement instanceof DefineStatement define) {
                definitions.declare(define);
            }
            return;
        }
        sealHeader(line);

        if (statement instanceof SetStatement set) {
            context.set(set);
        } else if (statement instanceof UnsetStatement unset) {
            for (String key : unset.keys()) {
                if (!context.unset(key)) problems.report(line.text(), line.lineNumber(), ProblemCode.MISSING_KEY, key);
            }
        } else if (statement instanceof UnsetAllStatement) {
            context.unsetAll();
        } else if (statement instanceof TermStatement termStatement) {
            Term term = canonical(termStatement.term(), corrections);
            if (term instanceof MemberList) throw new SemanticMismatchException("list(...) is only valid as an object");
            builder.internNode(GraphBuilder.endpoint(term).node());
        } else if (statement instanceof RelationStatement relation) {
            addRelation(relation, line, corrections);
        }
    }

    private void addRelation(RelationStatement statement, LogicalLine line, List<Correction> corrections) {
        if (context.citation() == null) {
            throw new MissingCitationException(ProblemCode.MISSING_CITATION, null);
        }
        if (settings.requireEvidence() && context.evidence() == null) {
            throw new MissingCitationException(ProblemCode.MISSING_EVIDENCE, null);
        }
        Term subject = canonical(statement.subject(), corrections);
        Term object = canonical(statement.object(), corrections);
        validator.validate(subject, statement.relation(), object);

        Endpoint from = GraphBuilder.endpoint(subject);
        List<Endpoint> targets = object instanceof MemberList list
                ? list.members().stream().map(GraphBuilder::endpoint).toList()
                : List.of(GraphBuilder.endpoint(object));

        ContextSnapshot snapshot = context.snapshot();
        NodeId subjectId = builder.internNode(from.node());
        for (Endpoint to : targets) {
            NodeId objectId = builder.internNode(to.node());
            builder.addEdge(subjectId, statement.relation().singular(), objectId, from.side(), to.side(),
                    snapshot, line.lineNumber());
        }
    }

    private Term canonical(Term raw, List<Correction> corrections) {
        NormalizedTerm normalized = normalizer.normalize(raw);
        identifiers.validate(normalized.term());
        corrections.addAll(normalized.corrections());
        return normalized.term();
    }

    private void sealHeader(LogicalLine line) {
        if (headerSealed) return;
        headerSealed = true;
        List<String> missing = settings.requiredDocumentKeys().stream()
                .filter(key -> !metadata.containsKey(key))
                .toList();
        if (!missing.isEmpty()) {
            throw fatal(line, ProblemCode.MISSING_DOCUMENT_METADATA, "SET DOCUMENT " + String.join(", ", missing), null);
        }
    }

    private FatalCompilationException fatal(LogicalLine line, ProblemCode code, String detail, Throwable cause) {
        aborted = true;
        ParseProblem problem = problems.report(line.text(), line.lineNumber(), code, detail);
        return new FatalCompilationException(problem, cause);
    }
}
