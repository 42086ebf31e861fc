package com.ragguard.model;

import lombok.Value;

@Value
public class CompletionResult {

    String text;
    TokenUsage usage;
}
