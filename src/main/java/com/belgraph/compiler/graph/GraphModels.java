package com.belgraph.compiler.graph;

import com.belgraph.compiler.context.ContextModels.ContextSnapshot;
import com.belgraph.compiler.term.BelWriter;
import com.belgraph.compiler.term.Relation;
import com.belgraph.compiler.term.TermModels.Identifier;
import com.belgraph.compiler.term.TermModels.Term;
import com.belgraph.compiler.term.TermModels.TermKind;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class GraphModels {
    /** Hash of the canonical BEL of a node; equal canonical terms always get the same id. */
    public record NodeId(String value) {
        public static NodeId of(String canonicalBel) {
            return new NodeId(DigestUtils.md5DigestAsHex(canonicalBel.getBytes(StandardCharsets.UTF_8)));
        }

        @Override
        public String toString() {
            return value;
        }
    }

    public record Node(NodeId id, TermKind kind, Term term, String bel) {}

    public enum EdgeModifier { NONE, ACTIVITY, TRANSLOCATION, DEGRADATION }

    public record EdgeSide(EdgeModifier modifier, Identifier activity, Identifier fromLocation,
                           Identifier toLocation, Identifier location) {
        public static final EdgeSide NONE = new EdgeSide(EdgeModifier.NONE, null, null, null, null);

        public static EdgeSide located(Identifier location) {
            return location == null ? NONE : new EdgeSide(EdgeModifier.NONE, null, null, null, location);
        }

        /** BEL-like text of the side, or null when the statement added nothing to the node. */
        public String describe() {
            List<String> parts = new ArrayList<>();
            switch (modifier) {
                case ACTIVITY -> parts.add(activity == null ? "act()" : "act(ma(" + BelWriter.identifier(activity) + "))");
                case TRANSLOCATION -> parts.add("tloc(fromLoc(" + BelWriter.identifier(fromLocation)
                        + "), toLoc(" + BelWriter.identifier(toLocation) + "))");
                case DEGRADATION -> parts.add("deg()");
                case NONE -> { }
            }
            if (location != null) parts.add("loc(" + BelWriter.identifier(location) + ")");
            return parts.isEmpty() ? null : String.join(", ", parts);
        }
    }

    /**
     * One edge of the multigraph. Structural edges (variant, component, reactant, product, origin) carry
     * {@code null} context and line 0.
     */
    public record Edge(int index, NodeId subject, Relation relation, NodeId object,
                       EdgeSide subjectSide, EdgeSide objectSide, ContextSnapshot context, int line) {
        public boolean isStructural() {
            return context == null;
        }
    }
}
