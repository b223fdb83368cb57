package com.nevis.chat.controller;

import com.nevis.chat.index.SourceStats;
import com.nevis.chat.service.CorpusIndexService;
import com.nevis.chat.service.IndexDiagnostics;
import com.nevis.chat.service.RetrievalWeightService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(OpsController.class)
class OpsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CorpusIndexService corpusIndexService;

    @MockitoBean
    private RetrievalWeightService retrievalWeightService;

    private static IndexDiagnostics diagnostics(int buildCount) {
        return new IndexDiagnostics(true, buildCount, 42L, Instant.parse("2026-10-18T09:00:00Z"), 120, 30,
            "data/chunks.jsonl", Map.of("support.clever.com", new SourceStats(100, 25)));
    }

    @Test
    @DisplayName("GET /ops/index should report index diagnostics")
    void indexDiagnostics_ShouldReturnStats() throws Exception {
        when(corpusIndexService.diagnostics()).thenReturn(diagnostics(1));

        mockMvc.perform(get("/ops/index"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.built").value(true))
            .andExpect(jsonPath("$.build_count").value(1))
            .andExpect(jsonPath("$.passage_count").value(120))
            .andExpect(jsonPath("$.corpus_path").value("data/chunks.jsonl"));
    }

    @Test
    @DisplayName("POST /ops/index/rebuild should rebuild and report the new index")
    void rebuildIndex_ShouldRebuild() throws Exception {
        when(corpusIndexService.diagnostics()).thenReturn(diagnostics(2));

        mockMvc.perform(post("/ops/index/rebuild"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.build_count").value(2));

        verify(corpusIndexService).rebuild();
    }

    @Test
    @DisplayName("POST /ops/retrieval-signals/recompute should recompute the listed chunks")
    void recompute_ShouldUseListedChunks() throws Exception {
        when(retrievalWeightService.recomputeSignals(List.of("a", "b"))).thenReturn(2);

        mockMvc.perform(post("/ops/retrieval-signals/recompute")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"chunk_ids\": [\"a\", \"b\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.processed").value(2));
    }

    @Test
    @DisplayName("POST /ops/retrieval-signals/recompute without a body should recompute everything")
    void recompute_ShouldRecomputeAll_WhenBodyMissing() throws Exception {
        when(retrievalWeightService.recomputeAll()).thenReturn(17);

        mockMvc.perform(post("/ops/retrieval-signals/recompute"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.processed").value(17));
    }
}
