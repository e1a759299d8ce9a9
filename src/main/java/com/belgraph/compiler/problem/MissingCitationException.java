package com.belgraph.compiler.problem;

public class MissingCitationException extends BelStatementException {
    public MissingCitationException(ProblemCode code, String detail) {
        super(code, detail);
    }
}
