package com.ragguard.model;

import com.google.gson.annotations.SerializedName;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Response-bound view of a retrieved document with sanitized metadata
 */
@Value
@Builder
public class RetrievedItem {

    String id;
    String title;
    String content;
    double score;

    @SerializedName("source_uri")
    String sourceUri;

    @SerializedName("source_kind")
    SourceKind sourceKind;

    Map<String, Object> metadata;
}
