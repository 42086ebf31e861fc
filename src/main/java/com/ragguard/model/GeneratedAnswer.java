package com.ragguard.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * Generated text with its citations
 */
@Value
@Builder
public class GeneratedAnswer {

    String text;

    @Builder.Default
    List<Citation> citations = Collections.emptyList();

    /** True when the prompt artifact was served from the prompt cache */
    boolean cached;

    @Builder.Default
    TokenUsage usage = TokenUsage.NONE;
}
