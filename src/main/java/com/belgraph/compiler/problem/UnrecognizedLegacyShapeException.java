package com.belgraph.compiler.problem;

public class UnrecognizedLegacyShapeException extends BelStatementException {
    public UnrecognizedLegacyShapeException(String detail) {
        super(ProblemCode.UNRECOGNIZED_LEGACY_SHAPE, detail);
    }
}
