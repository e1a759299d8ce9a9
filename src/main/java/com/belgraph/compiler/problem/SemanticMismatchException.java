package com.belgraph.compiler.problem;

public class SemanticMismatchException extends BelStatementException {
    public SemanticMismatchException(String detail) {
        super(ProblemCode.SEMANTIC_MISMATCH, detail);
    }
}
