package com.belgraph.compiler.graph;

import com.belgraph.compiler.graph.GraphModels.Edge;
import com.belgraph.compiler.graph.GraphModels.Node;
import com.belgraph.compiler.graph.GraphModels.NodeId;

import java.util.*;

public class BelGraph {
    private final Map<NodeId, Node> nodes = new LinkedHashMap<>();
    private final List<Edge> edges = new ArrayList<>();

    void putNode(Node node) {
        nodes.put(node.id(), node);
    }

    void addEdge(Edge edge) {
        edges.add(edge);
    }

    public Collection<Node> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public List<Edge> edges() {
        return Collections.unmodifiableList(edges);
    }

    public Optional<Node> node(NodeId id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean contains(NodeId id) {
        return nodes.containsKey(id);
    }

    public String canonicalBel(NodeId id) {
        Node node = nodes.get(id);
        if (node == null) throw new NoSuchElementException("No node " + id);
        return node.bel();
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public List<Edge> qualifiedEdges() {
        return edges.stream().filter(e -> !e.isStructural()).toList();
    }
}
