package com.belgraph.compiler.context;

import com.belgraph.compiler.context.ContextModels.Citation;
import com.belgraph.compiler.context.ContextModels.ContextSnapshot;
import com.belgraph.compiler.definition.DefinitionModels.ValueSet;
import com.belgraph.compiler.definition.DefinitionRegistry;
import com.belgraph.compiler.parser.StatementModels.DefinitionType;
import com.belgraph.compiler.parser.StatementModels.SetStatement;
import com.belgraph.compiler.problem.AnnotationException;
import com.belgraph.compiler.problem.ProblemCode;

import java.util.*;

public class AnnotationContext {
    public static final String CITATION = "Citation";
    public static final String EVIDENCE = "Evidence";
    public static final String SUPPORTING_TEXT = "SupportingText";
    public static final String STATEMENT_GROUP = "STATEMENT_GROUP";

    private final DefinitionRegistry definitions;
    private final boolean strictAnnotations;

    private Citation citation;
    private String evidence;
    private String statementGroup;
    private final Map<String, List<String>> annotations = new LinkedHashMap<>();

    public AnnotationContext(DefinitionRegistry definitions, boolean strictAnnotations) {
        this.definitions = definitions;
        this.strictAnnotations = strictAnnotations;
    }

    public void set(SetStatement statement) {
        String key = statement.key();
        List<String> values = statement.values();
        switch (key) {
            case CITATION -> {
                if (!statement.braced() || (values.size() != 3 && values.size() != 6)) {
                    throw new AnnotationException(ProblemCode.INVALID_CITATION,
                            "expected 3 or 6 fields in braces, found " + values.size());
                }
                citation = Citation.of(values);
            }
            case EVIDENCE, SUPPORTING_TEXT -> evidence = single(key, statement);
            case STATEMENT_GROUP -> statementGroup = single(key, statement);
            default -> {
                checkAnnotation(key, values);
                annotations.put(key, List.copyOf(new LinkedHashSet<>(values)));
            }
        }
    }

    /** @return false when the key was not active */
    public boolean unset(String key) {
        switch (key) {
            case CITATION -> {
                boolean wasSet = citation != null;
                citation = null;
                return wasSet;
            }
            case EVIDENCE, SUPPORTING_TEXT -> {
                boolean wasSet = evidence != null;
                evidence = null;
                return wasSet;
            }
            case STATEMENT_GROUP -> {
                boolean wasSet = statementGroup != null;
                statementGroup = null;
                return wasSet;
            }
            default -> {
                return annotations.remove(key) != null;
            }
        }
    }

    public void unsetAll() {
        citation = null;
        evidence = null;
        statementGroup = null;
        annotations.clear();
    }

    public Citation citation() {
        return citation;
    }

    public String evidence() {
        return evidence;
    }

    public ContextSnapshot snapshot() {
        return new ContextSnapshot(citation, evidence, statementGroup, annotations);
    }

    private void checkAnnotation(String key, List<String> values) {
        if (!definitions.isDefined(DefinitionType.ANNOTATION, key)) {
            if (strictAnnotations) throw new AnnotationException(ProblemCode.UNDEFINED_ANNOTATION, key);
            return;
        }
        Optional<ValueSet> allowed = definitions.valueSet(DefinitionType.ANNOTATION, key);
        for (String value : values) {
            if (allowed.isEmpty() || !allowed.get().contains(value)) {
                throw new AnnotationException(ProblemCode.ILLEGAL_ANNOTATION_VALUE, key + " = " + value);
            }
        }
    }

    private static String single(String key, SetStatement statement) {
        if (statement.braced() || statement.values().size() != 1) {
            throw new AnnotationException(ProblemCode.ILLEGAL_ANNOTATION_VALUE, key + " takes a single value");
        }
        return statement.values().get(0);
    }
}
