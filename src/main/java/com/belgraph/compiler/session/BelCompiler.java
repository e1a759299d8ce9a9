package com.belgraph.compiler.session;

import com.belgraph.compiler.config.CompilerSettings;
import com.belgraph.compiler.definition.DefinitionResolver;
import com.belgraph.compiler.definition.ResourceDefinitionResolver;
import com.belgraph.compiler.parser.BelStatementParser;
import com.belgraph.compiler.problem.FatalCompilationException;
import org.springframework.stereotype.Component;

/** Stateless; one instance can compile documents concurrently. */
@Component
public class BelCompiler {
    private final CompilerSettings settings;
    private final DefinitionResolver resolver;
    private final BelStatementParser parser;

    public BelCompiler(CompilerSettings settings, DefinitionResolver resolver, BelStatementParser parser) {
        this.settings = settings;
        this.resolver = resolver;
        this.parser = parser;
    }

    public static BelCompiler standalone(CompilerSettings settings) {
        return new BelCompiler(settings, ResourceDefinitionResolver.standalone(), new BelStatementParser());
    }

    public CompilationSession openSession() {
        return new CompilationSession(settings, resolver, parser);
    }

    public CompilationResult compile(String content) {
        return compile(content.lines().toList());
    }

    public CompilationResult compile(Iterable<String> lines) {
        CompilationSession session = openSession();
        try {
            for (String line : lines) {
                session.accept(line);
            }
            return session.finish();
        } catch (FatalCompilationException e) {
            return session.result();
        }
    }
}
