package com.belgraph.compiler.context;

import java.util.*;

public class ContextModels {
    /** Three-field or six-field citation; the last three fields are null for the short form. */
    public record Citation(String type, String name, String reference, String date, String authors, String comments) {
        public static Citation of(List<String> fields) {
            if (fields.size() == 3) {
                return new Citation(fields.get(0), fields.get(1), fields.get(2), null, null, null);
            }
            return new Citation(fields.get(0), fields.get(1), fields.get(2), fields.get(3), fields.get(4), fields.get(5));
        }
    }

    /**
     * Immutable copy of the context active when a statement was read. Edges hold it; later SET/UNSET lines never
     * change it.
     */
    public record ContextSnapshot(Citation citation, String evidence, String statementGroup,
                                  Map<String, List<String>> annotations) {
        public static final ContextSnapshot EMPTY = new ContextSnapshot(null, null, null, Map.of());

        public ContextSnapshot {
            Map<String, List<String>> copy = new LinkedHashMap<>();
            annotations.forEach((key, values) -> copy.put(key, List.copyOf(values)));
            annotations = Collections.unmodifiableMap(copy);
        }
    }
}
