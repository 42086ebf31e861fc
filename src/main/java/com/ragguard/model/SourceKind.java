package com.ragguard.model;

/**
 * Retrieval backend a document came from
 */
public enum SourceKind {

    PRIMARY_STORE("Knowledge Base"),
    SECONDARY_INDEX("Enterprise Search");

    private final String label;

    SourceKind(String label) {
        this.label = label;
    }

    /**
     * Human readable label used to disambiguate documents in prompts and citations
     */
    public String label() {
        return label;
    }
}
