package com.ragguard.model;

import lombok.Value;

import java.time.Instant;

/**
 * Reusable instruction portion of a generation request, built for one authorization scope
 */
@Value
public class PromptArtifact {

    String systemPrompt;
    String scopeKey;
    Instant builtAt;
}
