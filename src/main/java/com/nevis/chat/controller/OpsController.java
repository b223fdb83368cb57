package com.nevis.chat.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.chat.service.CorpusIndexService;
import com.nevis.chat.service.IndexDiagnostics;
import com.nevis.chat.service.RetrievalWeightService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Operational endpoints for the corpus index and retrieval weights.
 */
@Slf4j
@RestController
@RequestMapping("/ops")
@RequiredArgsConstructor
public class OpsController {

    private final CorpusIndexService corpusIndexService;
    private final RetrievalWeightService retrievalWeightService;

    public record RecomputeRequest(@JsonProperty("chunk_ids") List<String> chunkIds) {}

    @GetMapping("/index")
    public ResponseEntity<IndexDiagnostics> indexDiagnostics() {
        return ResponseEntity.ok(corpusIndexService.diagnostics());
    }

    @PostMapping("/index/rebuild")
    public ResponseEntity<IndexDiagnostics> rebuildIndex() {
        log.info("Index rebuild requested");
        corpusIndexService.rebuild();
        return ResponseEntity.ok(corpusIndexService.diagnostics());
    }

    @PostMapping("/retrieval-signals/recompute")
    public ResponseEntity<Map<String, Integer>> recomputeSignals(@RequestBody(required = false) RecomputeRequest request) {
        int processed = request == null || request.chunkIds() == null
            ? retrievalWeightService.recomputeAll()
            : retrievalWeightService.recomputeSignals(request.chunkIds());
        return ResponseEntity.ok(Map.of("processed", processed));
    }
}
