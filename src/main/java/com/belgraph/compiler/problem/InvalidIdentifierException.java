package com.belgraph.compiler.problem;

public class InvalidIdentifierException extends BelStatementException {
    public InvalidIdentifierException(ProblemCode code, String detail) {
        super(code, detail);
    }
}
