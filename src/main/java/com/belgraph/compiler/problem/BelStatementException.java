package com.belgraph.compiler.problem;

/**
 * A statement that cannot be made coherent. Thrown below the statement boundary and turned into an Error there.
 */
public class BelStatementException extends RuntimeException {
    private final ProblemCode code;
    private final String detail;

    public BelStatementException(ProblemCode code, String detail) {
        super(detail == null ? code.message() : code.message() + ": " + detail);
        this.code = code;
        this.detail = detail;
    }

    public ProblemCode code() {
        return code;
    }

    public String detail() {
        return detail;
    }
}
