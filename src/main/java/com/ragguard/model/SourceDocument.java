package com.ragguard.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Represents a document listed from the secondary content source, with its raw attributes
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceDocument {

    private String id;
    private String title;
    private String uri;
    private String content;
    private Map<String, Object> attributes;
}
