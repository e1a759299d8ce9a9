package com.belgraph.compiler.problem;

public record ParseProblem(ProblemCode code, String detail, int lineNumber, String line) {
    public ProblemCode.Severity severity() {
        return code.severity();
    }

    public String describe() {
        String text = detail == null || detail.isBlank() ? code.message() : code.message() + ": " + detail;
        return String.format("Line %07d - %s", lineNumber, text);
    }
}
