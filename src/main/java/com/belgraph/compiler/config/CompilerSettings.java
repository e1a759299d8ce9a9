package com.belgraph.compiler.config;

import com.belgraph.compiler.normalize.MalformedModifierPolicy;

import java.util.List;

public record CompilerSettings(List<String> requiredDocumentKeys,
                               boolean strictNamespaces,
                               boolean strictAnnotations,
                               boolean requireEvidence,
                               boolean completeOrigin,
                               MalformedModifierPolicy modifierPolicy) {
    public CompilerSettings {
        requiredDocumentKeys = requiredDocumentKeys == null ? List.of() : List.copyOf(requiredDocumentKeys);
        modifierPolicy = modifierPolicy == null ? MalformedModifierPolicy.strict() : modifierPolicy;
    }

    public static CompilerSettings defaults() {
        return new CompilerSettings(List.of(), false, false, false, false, MalformedModifierPolicy.strict());
    }

    public CompilerSettings withRequiredDocumentKeys(List<String> keys) {
        return new CompilerSettings(keys, strictNamespaces, strictAnnotations, requireEvidence, completeOrigin, modifierPolicy);
    }

    public CompilerSettings withStrictNamespaces(boolean strict) {
        return new CompilerSettings(requiredDocumentKeys, strict, strictAnnotations, requireEvidence, completeOrigin, modifierPolicy);
    }

    public CompilerSettings withStrictAnnotations(boolean strict) {
        return new CompilerSettings(requiredDocumentKeys, strictNamespaces, strict, requireEvidence, completeOrigin, modifierPolicy);
    }

    public CompilerSettings withRequireEvidence(boolean require) {
        return new CompilerSettings(requiredDocumentKeys, strictNamespaces, strictAnnotations, require, completeOrigin, modifierPolicy);
    }

    public CompilerSettings withCompleteOrigin(boolean complete) {
        return new CompilerSettings(requiredDocumentKeys, strictNamespaces, strictAnnotations, requireEvidence, complete, modifierPolicy);
    }

    public CompilerSettings withModifierPolicy(MalformedModifierPolicy policy) {
        return new CompilerSettings(requiredDocumentKeys, strictNamespaces, strictAnnotations, requireEvidence, completeOrigin, policy);
    }
}
