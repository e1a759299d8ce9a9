package com.belgraph.compiler.problem;

public class FatalCompilationException extends RuntimeException {
    private final ParseProblem problem;

    public FatalCompilationException(ParseProblem problem, Throwable cause) {
        super(problem.describe(), cause);
        this.problem = problem;
    }

    public ParseProblem problem() {
        return problem;
    }
}
