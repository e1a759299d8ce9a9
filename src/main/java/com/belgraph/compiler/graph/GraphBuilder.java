package com.belgraph.compiler.graph;

import com.belgraph.compiler.context.ContextModels.ContextSnapshot;
import com.belgraph.compiler.graph.GraphModels.*;
import com.belgraph.compiler.problem.MalformedTermException;
import com.belgraph.compiler.term.BelWriter;
import com.belgraph.compiler.term.Relation;
import com.belgraph.compiler.term.TermModels.*;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class GraphBuilder {
    static final Identifier INTRACELLULAR = new Identifier("GOCC", "intracellular");
    static final Identifier EXTRACELLULAR_SPACE = new Identifier("GOCC", "extracellular space");
    static final Identifier CELL_SURFACE = new Identifier("GOCC", "cell surface");

    private final BelGraph graph = new BelGraph();
    private final Set<String> unqualified = new HashSet<>();
    private final boolean completeOrigin;

    public GraphBuilder(boolean completeOrigin) {
        this.completeOrigin = completeOrigin;
    }

    public BelGraph graph() {
        return graph;
    }

    /**
     * Splits a statement term into the term that becomes the node and the edge side it implies. Does not touch
     * the graph.
     */
    public static Endpoint endpoint(Term term) {
        if (term instanceof ActivityTerm a) {
            Term target = nodeTerm(a.target(), term);
            return new Endpoint(withoutLocation(target),
                    new EdgeSide(EdgeModifier.ACTIVITY, a.molecularActivity(), null, null, locationOf(target)));
        }
        if (term instanceof TransformationTerm t) {
            Term target = withoutLocation(nodeTerm(t.target(), term));
            EdgeSide side = switch (t.kind()) {
                case TRANSLOCATION -> new EdgeSide(EdgeModifier.TRANSLOCATION, null, t.fromLocation(), t.toLocation(), null);
                case CELL_SECRETION -> new EdgeSide(EdgeModifier.TRANSLOCATION, null, INTRACELLULAR, EXTRACELLULAR_SPACE, null);
                case CELL_SURFACE_EXPRESSION -> new EdgeSide(EdgeModifier.TRANSLOCATION, null, INTRACELLULAR, CELL_SURFACE, null);
                default -> new EdgeSide(EdgeModifier.DEGRADATION, null, null, null, null);
            };
            return new Endpoint(target, side);
        }
        Term node = nodeTerm(term, term);
        return new Endpoint(withoutLocation(node), EdgeSide.located(locationOf(node)));
    }

    public NodeId internNode(Term term) {
        String bel = BelWriter.write(term);
        NodeId id = NodeId.of(bel);
        if (graph.contains(id)) return id;
        graph.putNode(new Node(id, term.kind(), term, bel));

        if (term instanceof EntityTerm e) {
            if (!e.variants().isEmpty()) {
                NodeId parent = internNode(e.withoutVariants());
                addUnqualifiedEdge(parent, Relation.HAS_VARIANT, id);
            } else if (completeOrigin) {
                completeOrigin(e, id);
            }
        } else if (term instanceof ListTerm l) {
            for (Term member : l.members()) {
                addUnqualifiedEdge(id, Relation.HAS_COMPONENT, internNode(member));
            }
        } else if (term instanceof ReactionTerm r) {
            for (Term reactant : r.reactants()) {
                addUnqualifiedEdge(id, Relation.HAS_REACTANT, internNode(reactant));
            }
            for (Term product : r.products()) {
                addUnqualifiedEdge(id, Relation.HAS_PRODUCT, internNode(product));
            }
        }
        return id;
    }

    /** Appends a statement edge. Equal triples with other contexts stay separate edges. */
    public int addEdge(NodeId subject, Relation relation, NodeId object, EdgeSide subjectSide, EdgeSide objectSide,
                       ContextSnapshot context, int line) {
        int index = graph.edgeCount();
        graph.addEdge(new Edge(index, subject, relation, object, subjectSide, objectSide, context, line));
        return index;
    }

    /** Adds a structural edge once per (subject, relation, object). */
    public void addUnqualifiedEdge(NodeId subject, Relation relation, NodeId object) {
        if (!unqualified.add(subject + " " + relation + " " + object)) return;
        graph.addEdge(new Edge(graph.edgeCount(), subject, relation, object, EdgeSide.NONE, EdgeSide.NONE, null, 0));
    }

    private void completeOrigin(EntityTerm e, NodeId id) {
        if (e.kind() == TermKind.PROTEIN) {
            NodeId rna = internNode(new EntityTerm(TermKind.RNA, e.identifier(), List.of(), null));
            addUnqualifiedEdge(rna, Relation.TRANSLATED_TO, id);
        } else if (e.kind() == TermKind.RNA || e.kind() == TermKind.MIRNA) {
            NodeId gene = internNode(new EntityTerm(TermKind.GENE, e.identifier(), List.of(), null));
            addUnqualifiedEdge(gene, Relation.TRANSCRIBED_TO, id);
        }
    }

    private static Term nodeTerm(Term term, Term statementTerm) {
        if (term instanceof EntityTerm || term instanceof ListTerm || term instanceof FusionTerm || term instanceof ReactionTerm) {
            return term;
        }
        throw new MalformedTermException("cannot make a node of " + BelWriter.write(term) + " in " + BelWriter.write(statementTerm));
    }

    private static Identifier locationOf(Term term) {
        if (term instanceof EntityTerm e) return e.location();
        if (term instanceof ListTerm l) return l.location();
        if (term instanceof FusionTerm f) return f.location();
        return null;
    }

    private static Term withoutLocation(Term term) {
        if (term instanceof EntityTerm e) return e.withoutLocation();
        if (term instanceof ListTerm l && l.location() != null) return new ListTerm(l.kind(), l.members(), null);
        if (term instanceof FusionTerm f && f.location() != null) {
            return new FusionTerm(f.kind(), f.partner5p(), f.range5p(), f.partner3p(), f.range3p(), null);
        }
        return term;
    }

    public record Endpoint(Term node, EdgeSide side) {}
}
