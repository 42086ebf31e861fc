package com.ragguard.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Canonical document ready to be written to object storage for indexing
 */
@Value
@Builder
public class StagedDocument {

    String objectKey;
    String body;
    Map<String, String> metadata;
    AccessPolicy accessPolicy;
    ClassificationResult classification;
}
