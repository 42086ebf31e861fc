package com.ragguard.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Document snippet returned by a retrieval backend.
 * Scores are backend-assigned and not comparable across backends.
 */
@Value
public class ScoredDocument {

    String id;
    String content;
    String title;
    String sourceUri;
    double score;
    Map<String, Object> metadata;
    AccessPolicy accessPolicy;
    SourceKind sourceKind;

    @Builder(toBuilder = true)
    private ScoredDocument(String id, String content, String title, String sourceUri, double score,
                           Map<String, Object> metadata, AccessPolicy accessPolicy, SourceKind sourceKind) {
        this.id = id;
        this.content = content != null ? content : "";
        this.title = title != null ? title : "";
        this.sourceUri = sourceUri != null ? sourceUri : "";
        this.score = score;
        this.metadata = metadata == null || metadata.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.accessPolicy = accessPolicy != null ? accessPolicy : AccessPolicy.empty();
        this.sourceKind = sourceKind;
    }
}
