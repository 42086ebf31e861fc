package com.ragguard.model;

import com.google.gson.annotations.SerializedName;
import lombok.Value;

@Value
public class TokenUsage {

    public static final TokenUsage NONE = new TokenUsage(0, 0, 0);

    @SerializedName("prompt_tokens")
    int promptTokens;

    @SerializedName("output_tokens")
    int outputTokens;

    @SerializedName("cached_tokens")
    int cachedTokens;
}
