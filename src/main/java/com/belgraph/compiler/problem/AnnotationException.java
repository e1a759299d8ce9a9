package com.belgraph.compiler.problem;

public class AnnotationException extends BelStatementException {
    public AnnotationException(ProblemCode code, String detail) {
        super(code, detail);
    }
}
