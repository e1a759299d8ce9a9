package com.belgraph.compiler.api;

import com.belgraph.compiler.repository.GraphJdbcRepository.GraphRow;
import com.belgraph.compiler.service.StoredGraphService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/graphs")
public class StoredGraphController {
    private final StoredGraphService graphService;

    public StoredGraphController(StoredGraphService graphService) {
        this.graphService = graphService;
    }

    @GetMapping
    public ResponseEntity<List<GraphRow>> graphs() {
        return ResponseEntity.ok(graphService.listGraphs());
    }

    @GetMapping("/{name}/versions")
    public ResponseEntity<List<String>> versions(@PathVariable String name) {
        return ResponseEntity.ok(graphService.versions(name));
    }

    @GetMapping("/{name}/{version}")
    public ResponseEntity<StoredGraphService.StoredGraph> graph(@PathVariable String name, @PathVariable String version) {
        return graphService.read(name, version)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
