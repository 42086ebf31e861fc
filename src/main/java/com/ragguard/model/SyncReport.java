package com.ragguard.model;

import com.google.gson.annotations.SerializedName;
import lombok.Builder;
import lombok.Value;

/**
 * Counters of one ingestion sync run
 */
@Value
@Builder
public class SyncReport {

    @SerializedName("documents_found")
    int documentsFound;

    @SerializedName("documents_staged")
    int documentsStaged;

    @SerializedName("documents_skipped")
    int documentsSkipped;

    @SerializedName("documents_failed")
    int documentsFailed;

    @SerializedName("ingestion_job_id")
    String ingestionJobId;

    /** Set when the run could not list source documents */
    String error;

    /** False when another sync was already running and this one did nothing */
    boolean executed;

    public static SyncReport skipped() {
        return SyncReport.builder().executed(false).build();
    }
}
