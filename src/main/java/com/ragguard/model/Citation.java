package com.ragguard.model;

import com.google.gson.annotations.SerializedName;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Source reference attached to a generated answer, one per context document
 */
@Value
@Builder
public class Citation {

    int index;
    String label;
    String title;

    @SerializedName("source_uri")
    String sourceUri;

    String content;
    Map<String, Object> metadata;
    double score;

    @SerializedName("source_kind")
    SourceKind sourceKind;
}
