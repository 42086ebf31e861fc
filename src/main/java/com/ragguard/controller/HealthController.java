package com.ragguard.controller;

import com.ragguard.backend.GenerativeModel;
import com.ragguard.backend.SolrKeywordIndex;
import com.ragguard.backend.VectorRetriever;
import com.ragguard.service.IngestionSyncService;
import com.ragguard.service.PromptCache;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health check endpoints
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final SolrKeywordIndex solrKeywordIndex;
    private final VectorRetriever vectorRetriever;
    private final GenerativeModel generativeModel;
    private final PromptCache promptCache;
    private final IngestionSyncService ingestionSyncService;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> status = new LinkedHashMap<>();

        boolean solrUp = solrKeywordIndex.isAvailable();
        status.put("status", "UP");
        status.put("solr", solrUp ? "UP" : "DOWN");
        status.put("documentsIndexed", solrUp ? solrKeywordIndex.getDocumentCount() : 0);
        status.put("knowledgeBase", vectorRetriever.isAvailable() ? "UP" : "DOWN");
        status.put("gemini", generativeModel.isAvailable() ? "UP" : "DOWN");
        status.put("promptCacheSize", promptCache.size());
        status.put("promptCacheHits", promptCache.getHits());
        status.put("promptCacheMisses", promptCache.getMisses());
        status.put("syncInProgress", ingestionSyncService.isSyncInProgress());

        return ResponseEntity.ok(status);
    }

    @GetMapping("/")
    public ResponseEntity<Map<String, String>> root() {
        return ResponseEntity.ok(Map.of(
                "application", "RagGuard - Access-Controlled Retrieval Gateway",
                "version", "1.0.0",
                "status", "running"
        ));
    }
}
