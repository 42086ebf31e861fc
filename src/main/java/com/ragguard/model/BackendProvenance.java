package com.ragguard.model;

import com.google.gson.annotations.SerializedName;
import lombok.Value;

/**
 * Per-backend counts for a merged result set
 */
@Value
public class BackendProvenance {

    @SerializedName("source_kind")
    SourceKind sourceKind;

    /** Documents the backend returned */
    int returned;

    /** Documents from this backend that made it into the final result set */
    int retained;

    String error;
}
