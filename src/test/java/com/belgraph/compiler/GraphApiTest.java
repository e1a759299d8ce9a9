package com.belgraph.compiler;

import com.belgraph.compiler.api.DocumentCompileController.CompileRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class GraphApiTest {
    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private ObjectMapper objectMapper;

    private String body(String content, boolean dryRun) throws Exception {
        return objectMapper.writeValueAsString(new CompileRequest(content, dryRun));
    }

    private static String document(String name) {
        return """
                SET DOCUMENT Name = "%s"
                SET DOCUMENT Version = "2.1"
                SET Citation = {"PubMed", "Some Journal", "12345"}
                p(HGNC:AKT1) -> p(HGNC:JUN)
                p(HGNC:AKT1) -> p(HGNC:JUN
                """.formatted(name);
    }

    @Test
    void compilesStoresAndServesGraph() throws Exception {
        String name = "api-" + UUID.randomUUID();
        mockMvc.perform(post("/api/documents/compile").contentType(MediaType.APPLICATION_JSON).content(body(document(name), false)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stored").value(true))
                .andExpect(jsonPath("$.edgeCount").value(1))
                .andExpect(jsonPath("$.excludedStatements").value(1))
                .andExpect(jsonPath("$.errors[0].code").value(201))
                .andExpect(jsonPath("$.errors[0].line").value(5));

        mockMvc.perform(get("/api/graphs/{name}/versions", name))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value("2.1"));

        mockMvc.perform(get("/api/graphs/{name}/{version}", name, "2.1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.graph.nodeCount").value(2))
                .andExpect(jsonPath("$.edges[0].edge.relation").value("increases"));
    }

    @Test
    void secondStoreIsConflict() throws Exception {
        String name = "api-dup-" + UUID.randomUUID();
        mockMvc.perform(post("/api/documents/compile").contentType(MediaType.APPLICATION_JSON).content(body(document(name), false)))
                .andExpect(status().isOk());
        mockMvc.perform(post("/api/documents/compile").contentType(MediaType.APPLICATION_JSON).content(body(document(name), false)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("GRAPH_ALREADY_STORED"));
    }

    @Test
    void emptyDocumentIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/documents/compile").contentType(MediaType.APPLICATION_JSON).content(body("", true)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    void unknownGraphIsNotFound() throws Exception {
        mockMvc.perform(get("/api/graphs/{name}/{version}", "missing-" + UUID.randomUUID(), "1.0"))
                .andExpect(status().isNotFound());
    }
}
