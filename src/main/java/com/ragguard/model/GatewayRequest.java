package com.ragguard.model;

import com.google.gson.annotations.SerializedName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Query-path request payload
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GatewayRequest {

    private String query;

    @SerializedName("user_id")
    private String userId;

    @SerializedName("user_groups")
    private List<String> userGroups;

    @SerializedName("max_results")
    private Integer maxResults;

    private String type;

    @SerializedName("use_caching")
    private Boolean useCaching;

    private List<String> sources;

    @SerializedName("user_token")
    private String userToken;
}
