package com.ragguard.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Authorized, ranked and truncated documents from all queried backends
 */
@Value
@Builder
public class MergedResultSet {

    @Builder.Default
    List<ScoredDocument> documents = Collections.emptyList();

    /** Authorized documents before truncation */
    int totalCount;

    /** Keyed by backend name, in query order */
    @Builder.Default
    Map<String, BackendProvenance> provenance = Collections.emptyMap();

    public boolean isEmpty() {
        return documents.isEmpty();
    }
}
