package com.belgraph.compiler.repository;

import com.belgraph.compiler.context.ContextModels.Citation;
import com.belgraph.compiler.context.ContextModels.ContextSnapshot;
import com.belgraph.compiler.graph.BelGraph;
import com.belgraph.compiler.graph.GraphModels.Edge;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class GraphJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public GraphJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * @throws org.springframework.dao.DuplicateKeyException when the name and version are already stored
     */
    public void insertGraph(String name, String version, BelGraph graph) {
        jdbcTemplate.update("INSERT INTO bel_graphs(name, version, node_count, edge_count) VALUES (?,?,?,?)",
                name, version, graph.nodeCount(), graph.edgeCount());

        graph.nodes().forEach(n -> jdbcTemplate.update(
                "INSERT INTO bel_nodes(graph_name, graph_version, node_id, kind, bel) VALUES (?,?,?,?,?)",
                name, version, n.id().value(), n.kind().name(), n.bel()));

        for (Edge e : graph.edges()) {
            ContextSnapshot context = e.context();
            Citation citation = context == null ? null : context.citation();
            jdbcTemplate.update(
                    "INSERT INTO bel_edges(graph_name, graph_version, edge_index, subject_id, relation, object_id, "
                            + "subject_modifier, object_modifier, citation_type, citation_reference, evidence, "
                            + "statement_group, line_number) VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?)",
                    name, version, e.index(), e.subject().value(), e.relation().keyword(), e.object().value(),
                    e.subjectSide().describe(), e.objectSide().describe(),
                    citation == null ? null : citation.type(),
                    citation == null ? null : citation.reference(),
                    context == null ? null : context.evidence(),
                    context == null ? null : context.statementGroup(),
                    e.line());
            if (context == null) continue;
            context.annotations().forEach((key, values) -> values.forEach(value -> jdbcTemplate.update(
                    "INSERT INTO bel_edge_annotations(graph_name, graph_version, edge_index, annotation_key, annotation_value) VALUES (?,?,?,?,?)",
                    name, version, e.index(), key, value)));
        }
    }

    public List<GraphRow> loadGraphs() {
        return jdbcTemplate.query(
                "SELECT name, version, node_count, edge_count FROM bel_graphs ORDER BY name, version",
                (rs, rowNum) -> new GraphRow(rs.getString(1), rs.getString(2), rs.getInt(3), rs.getInt(4)));
    }

    public List<String> loadVersions(String name) {
        return jdbcTemplate.queryForList("SELECT version FROM bel_graphs WHERE name = ? ORDER BY version", String.class, name);
    }

    public List<GraphRow> loadGraph(String name, String version) {
        return jdbcTemplate.query(
                "SELECT name, version, node_count, edge_count FROM bel_graphs WHERE name = ? AND version = ?",
                (rs, rowNum) -> new GraphRow(rs.getString(1), rs.getString(2), rs.getInt(3), rs.getInt(4)),
                name, version);
    }

    public List<NodeRow> loadNodes(String name, String version) {
        return jdbcTemplate.query(
                "SELECT node_id, kind, bel FROM bel_nodes WHERE graph_name = ? AND graph_version = ? ORDER BY bel",
                (rs, rowNum) -> new NodeRow(rs.getString(1), rs.getString(2), rs.getString(3)),
                name, version);
    }

    public List<EdgeRow> loadEdges(String name, String version) {
        return jdbcTemplate.query(
                "SELECT edge_index, subject_id, relation, object_id, subject_modifier, object_modifier, citation_type, "
                        + "citation_reference, evidence, statement_group, line_number "
                        + "FROM bel_edges WHERE graph_name = ? AND graph_version = ? ORDER BY edge_index",
                (rs, rowNum) -> new EdgeRow(rs.getInt(1), rs.getString(2), rs.getString(3), rs.getString(4),
                        rs.getString(5), rs.getString(6), rs.getString(7), rs.getString(8), rs.getString(9),
                        rs.getString(10), rs.getInt(11)),
                name, version);
    }

    public List<AnnotationRow> loadAnnotations(String name, String version) {
        return jdbcTemplate.query(
                "SELECT edge_index, annotation_key, annotation_value FROM bel_edge_annotations "
                        + "WHERE graph_name = ? AND graph_version = ? ORDER BY edge_index, annotation_key, annotation_value",
                (rs, rowNum) -> new AnnotationRow(rs.getInt(1), rs.getString(2), rs.getString(3)),
                name, version);
    }

    public record GraphRow(String name, String version, int nodeCount, int edgeCount) {}
    public record NodeRow(String nodeId, String kind, String bel) {}
    public record EdgeRow(int index, String subjectId, String relation, String objectId,
                          String subjectModifier, String objectModifier, String citationType,
                          String citationReference, String evidence, String statementGroup, int line) {}
    public record AnnotationRow(int edgeIndex, String key, String value) {}
}
