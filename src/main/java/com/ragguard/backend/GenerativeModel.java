package com.ragguard.backend;

import com.ragguard.exception.UpstreamGenerationException;
import com.ragguard.model.ChatMessage;
import com.ragguard.model.CompletionResult;

import java.util.List;

/**
 * Text-completion service
 */
public interface GenerativeModel {

    /**
     * @param cacheHint true when the system prompt is a stable, reusable prefix worth caching upstream
     * @throws UpstreamGenerationException when the call fails or times out
     */
    CompletionResult complete(String systemPrompt, List<ChatMessage> messages, boolean cacheHint);

    boolean isAvailable();
}
