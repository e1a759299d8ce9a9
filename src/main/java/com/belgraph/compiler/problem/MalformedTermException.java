package com.belgraph.compiler.problem;

public class MalformedTermException extends BelStatementException {
    public MalformedTermException(String detail) {
        super(ProblemCode.MALFORMED_TERM, detail);
    }
}
