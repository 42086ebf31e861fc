package com.ragguard.model;

import lombok.Builder;
import lombok.Value;

/**
 * Inferred classification and owning department of a document
 */
@Value
@Builder
public class ClassificationResult {

    public enum Basis { PATH, ACL, FILENAME, DEFAULT }

    Classification classification;
    String department;

    /** Creator taken from the path, when the path carried one */
    String createdBy;

    Basis basis;
}
