package com.belgraph.compiler.api;

import com.belgraph.compiler.service.DocumentCompileService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/documents")
public class DocumentCompileController {
    private final DocumentCompileService compileService;

    public DocumentCompileController(DocumentCompileService compileService) {
        this.compileService = compileService;
    }

    @PostMapping("/compile")
    public ResponseEntity<DocumentCompileService.CompileSummary> compile(@RequestBody CompileRequest request) {
        return ResponseEntity.ok(compileService.compile(request.content(), request.dryRun()));
    }

    public record CompileRequest(String content, boolean dryRun) {}
}
