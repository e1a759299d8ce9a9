package com.belgraph.compiler.problem;

public enum ProblemCode {
    LEGACY_MOLECULAR_ACTIVITY(101, Severity.WARNING, "legacy molecular activity"),
    LEGACY_GENE_SUBSTITUTION(102, Severity.WARNING, "legacy gene substitution"),
    LEGACY_PROTEIN_SUBSTITUTION(103, Severity.WARNING, "legacy protein substitution"),
    LEGACY_TRUNCATION(104, Severity.WARNING, "legacy truncation"),
    LEGACY_PROTEIN_MODIFICATION(105, Severity.WARNING, "legacy protein modification"),
    LEGACY_TRANSLOCATION(106, Severity.WARNING, "legacy translocation"),
    MISSING_KEY(110, Severity.WARNING, "missing key"),
    MALFORMED_MODIFIER_DROPPED(111, Severity.WARNING, "malformed modifier dropped"),

    GENERAL_PARSER_FAILURE(200, Severity.ERROR, "general parser failure"),
    MALFORMED_TERM(201, Severity.ERROR, "malformed term"),
    SEMANTIC_MISMATCH(202, Severity.ERROR, "semantic mismatch"),
    MISSING_CITATION(203, Severity.ERROR, "missing citation"),
    MISSING_EVIDENCE(204, Severity.ERROR, "missing evidence"),
    UNRECOGNIZED_LEGACY_SHAPE(205, Severity.ERROR, "unrecognized legacy shape"),
    UNDEFINED_NAMESPACE(206, Severity.ERROR, "undefined namespace"),
    INVALID_NAMESPACE_VALUE(207, Severity.ERROR, "invalid namespace value"),
    UNDEFINED_ANNOTATION(208, Severity.ERROR, "undefined annotation"),
    ILLEGAL_ANNOTATION_VALUE(209, Severity.ERROR, "illegal annotation value"),
    INVALID_CITATION(210, Severity.ERROR, "invalid citation"),
    NESTED_RELATION(211, Severity.ERROR, "nested relation not supported"),
    MISPLACED_DEFINITION(212, Severity.ERROR, "header statement after header"),
    DUPLICATE_DEFINITION(213, Severity.ERROR, "duplicate definition"),

    UNRESOLVED_DEFINITION(300, Severity.FATAL, "unresolved definition"),
    MISSING_DOCUMENT_METADATA(301, Severity.FATAL, "missing document metadata");

    public enum Severity { WARNING, ERROR, FATAL }

    private final int code;
    private final Severity severity;
    private final String message;

    ProblemCode(int code, Severity severity, String message) {
        this.code = code;
        this.severity = severity;
        this.message = message;
    }

    public int code() {
        return code;
    }

    public Severity severity() {
        return severity;
    }

    public String message() {
        return message;
    }
}
