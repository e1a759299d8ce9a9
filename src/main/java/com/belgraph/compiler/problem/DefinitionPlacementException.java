package com.belgraph.compiler.problem;

public class DefinitionPlacementException extends BelStatementException {
    public DefinitionPlacementException(ProblemCode code, String detail) {
        super(code, detail);
    }
}
