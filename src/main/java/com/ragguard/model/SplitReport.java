package com.ragguard.model;

import com.google.gson.annotations.SerializedName;
import lombok.Value;

import java.util.List;

/**
 * Outcome of splitting one stored PDF
 */
@Value
public class SplitReport {

    @SerializedName("source_key")
    String sourceKey;

    @SerializedName("page_count")
    int pageCount;

    boolean split;

    @SerializedName("output_keys")
    List<String> outputKeys;
}
