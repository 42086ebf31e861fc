package com.ragguard.backend;

import com.ragguard.acl.AclNormalizer;
import com.ragguard.model.AccessPolicy;
import com.ragguard.model.BackendResult;
import com.ragguard.model.ScoredDocument;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared failure handling and ACL normalization for backend adapters.
 * Subclasses only fetch raw documents.
 */
@Slf4j
public abstract class AbstractQueryAdapter implements BackendQueryAdapter {

    private final AclNormalizer aclNormalizer;

    protected AbstractQueryAdapter(AclNormalizer aclNormalizer) {
        this.aclNormalizer = aclNormalizer;
    }

    protected abstract List<ScoredDocument> fetch(String text, QueryScope scope, int limit) throws IOException;

    @Override
    public final BackendResult query(String text, QueryScope scope, int limit) {
        long startTime = System.currentTimeMillis();
        try {
            List<ScoredDocument> raw = fetch(text, scope, limit);
            List<ScoredDocument> documents = new ArrayList<>(raw.size());
            for (ScoredDocument document : raw) {
                documents.add(document.toBuilder()
                        .accessPolicy(policyFor(document))
                        .sourceKind(sourceKind())
                        .build());
            }
            long elapsed = System.currentTimeMillis() - startTime;
            log.info("Backend {} returned {} documents in {}ms", name(), documents.size(), elapsed);

            return BackendResult.builder()
                    .backendName(name())
                    .sourceKind(sourceKind())
                    .documents(documents)
                    .authorizationMode(authorizationMode())
                    .elapsedMs(elapsed)
                    .build();

        } catch (IOException | RuntimeException e) {
            long elapsed = System.currentTimeMillis() - startTime;
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warn("Backend {} failed after {}ms: {}", name(), elapsed, error);
            return BackendResult.failed(name(), sourceKind(), authorizationMode(), error, elapsed);
        }
    }

    private AccessPolicy policyFor(ScoredDocument document) {
        AccessPolicy normalized = aclNormalizer.normalize(document.getMetadata());
        if (normalized.isEmpty() && !document.getAccessPolicy().isEmpty()) {
            return document.getAccessPolicy();
        }
        return normalized;
    }
}
