package com.belgraph.compiler.service;

import com.belgraph.compiler.repository.GraphJdbcRepository;
import com.belgraph.compiler.repository.GraphJdbcRepository.AnnotationRow;
import com.belgraph.compiler.repository.GraphJdbcRepository.EdgeRow;
import com.belgraph.compiler.repository.GraphJdbcRepository.GraphRow;
import com.belgraph.compiler.repository.GraphJdbcRepository.NodeRow;
import com.belgraph.compiler.session.CompilationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class StoredGraphService {
    private static final Logger log = LoggerFactory.getLogger(StoredGraphService.class);

    private final GraphJdbcRepository repository;
    private final Map<String, StoredGraph> graphCache = new ConcurrentHashMap<>();

    public StoredGraphService(GraphJdbcRepository repository) {
        this.repository = repository;
    }

    /**
     * @throws org.springframework.dao.DuplicateKeyException when the name and version are already stored
     */
    @Transactional
    public void store(CompilationResult result) {
        if (!result.complete() || result.name() == null || result.version() == null) {
            throw new IllegalArgumentException("Only complete graphs with a Name and Version can be stored");
        }
        repository.insertGraph(result.name(), result.version(), result.graph());
        log.info("Stored graph {} {} ({} nodes, {} edges)", result.name(), result.version(),
                result.graph().nodeCount(), result.graph().edgeCount());
    }

    public List<GraphRow> listGraphs() {
        return repository.loadGraphs();
    }

    public List<String> versions(String name) {
        return repository.loadVersions(name);
    }

    public Optional<StoredGraph> read(String name, String version) {
        String key = name + "\u0000" + version;
        StoredGraph cached = graphCache.get(key);
        if (cached != null) return Optional.of(cached);

        List<GraphRow> graphs = repository.loadGraph(name, version);
        if (graphs.isEmpty()) return Optional.empty();

        Map<Integer, Map<String, List<String>>> annotations = new HashMap<>();
        for (AnnotationRow row : repository.loadAnnotations(name, version)) {
            annotations.computeIfAbsent(row.edgeIndex(), i -> new TreeMap<>())
                    .computeIfAbsent(row.key(), k -> new ArrayList<>())
                    .add(row.value());
        }
        List<StoredEdge> edges = repository.loadEdges(name, version).stream()
                .map(e -> new StoredEdge(e, annotations.getOrDefault(e.index(), Map.of())))
                .toList();

        StoredGraph graph = new StoredGraph(graphs.get(0), repository.loadNodes(name, version), edges);
        graphCache.put(key, graph);
        return Optional.of(graph);
    }

    public record StoredEdge(EdgeRow edge, Map<String, List<String>> annotations) {}

    public record StoredGraph(GraphRow graph, List<NodeRow> nodes, List<StoredEdge> edges) {}
}
