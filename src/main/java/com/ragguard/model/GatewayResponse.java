package com.ragguard.model;

import com.google.gson.annotations.SerializedName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Success envelope. Fields that do not apply to the request type stay null and are
 * left out of the serialized JSON.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GatewayResponse {

    private String type;
    private String query;

    private List<RetrievedItem> results;

    @SerializedName("total_results")
    private Integer totalResults;

    @SerializedName("generated_response")
    private String generatedResponse;

    private List<Citation> citations;

    private Boolean cached;

    private Map<String, BackendProvenance> backends;

    private String timestamp;
}
