package com.ragguard.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one backend query. A failed backend carries no documents and an error annotation.
 */
@Value
@Builder
public class BackendResult {

    String backendName;
    SourceKind sourceKind;
    @Builder.Default
    List<ScoredDocument> documents = Collections.emptyList();
    AuthorizationMode authorizationMode;
    String error;
    long elapsedMs;

    public static BackendResult failed(String backendName, SourceKind sourceKind,
                                       AuthorizationMode mode, String error, long elapsedMs) {
        return BackendResult.builder()
                .backendName(backendName)
                .sourceKind(sourceKind)
                .authorizationMode(mode)
                .error(error)
                .elapsedMs(elapsedMs)
                .build();
    }

    public boolean isFailed() {
        return error != null;
    }
}
