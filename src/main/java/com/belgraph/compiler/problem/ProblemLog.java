package com.belgraph.compiler.problem;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ProblemLog {
    private static final Logger log = LoggerFactory.getLogger(ProblemLog.class);

    private final List<ParseProblem> warnings = new ArrayList<>();
    private final List<ParseProblem> errors = new ArrayList<>();
    private ParseProblem fatal;
    private int statementsProcessed;
    private int excludedStatements;

    public ParseProblem report(String line, int lineNumber, ProblemCode code, String detail) {
        ParseProblem problem = new ParseProblem(code, detail, lineNumber, line);
        switch (code.severity()) {
            case WARNING -> {
                warnings.add(problem);
                log.debug("{}", problem.describe());
            }
            case ERROR -> {
                errors.add(problem);
                log.warn("{} [{}]", problem.describe(), line);
            }
            case FATAL -> {
                if (fatal == null) fatal = problem;
                log.error("{} [{}]", problem.describe(), line);
            }
        }
        return problem;
    }

    public void statementProcessed() {
        statementsProcessed++;
    }

    public void statementExcluded() {
        excludedStatements++;
    }

    public List<ParseProblem> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public List<ParseProblem> errors() {
        return Collections.unmodifiableList(errors);
    }

    public ParseProblem fatal() {
        return fatal;
    }

    public int statementsProcessed() {
        return statementsProcessed;
    }

    public int excludedStatements() {
        return excludedStatements;
    }
}
