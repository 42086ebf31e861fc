package com.ragguard.backend;

import java.io.IOException;
import java.util.Optional;

/**
 * Starts indexing of staged documents into the primary knowledge store
 */
public interface KnowledgeBaseIngestion {

    /**
     * @return the ingestion job id, when the store reports one
     */
    Optional<String> startIngestion(String description) throws IOException;
}
