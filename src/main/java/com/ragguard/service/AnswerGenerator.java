package com.ragguard.service;

import com.ragguard.backend.GenerativeModel;
import com.ragguard.model.CallerContext;
import com.ragguard.model.ChatMessage;
import com.ragguard.model.Citation;
import com.ragguard.model.CompletionResult;
import com.ragguard.model.GeneratedAnswer;
import com.ragguard.model.MergedResultSet;
import com.ragguard.model.PromptArtifact;
import com.ragguard.model.ScoredDocument;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Grounded answer generation over a merged result set
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnswerGenerator {

    public static final String NO_RESULTS_MESSAGE = "No relevant authorized documents were found for your query.";

    static final int MAX_CONTENT_CHARS = 2000;
    static final String GROUPS_PLACEHOLDER = "{{groups}}";

    private final GenerativeModel generativeModel;
    private final PromptCache promptCache;
    private final MetadataSanitizer metadataSanitizer;
    private final Clock clock;

    @Value("classpath:prompts/answer-instructions.txt")
    private Resource promptTemplateResource;

    private String promptTemplate;

    @PostConstruct
    public void init() throws IOException {
        this.promptTemplate = StreamUtils.copyToString(promptTemplateResource.getInputStream(), StandardCharsets.UTF_8);
        log.info("Loaded answer prompt template ({} chars)", promptTemplate.length());
    }

    public GeneratedAnswer generate(String query, MergedResultSet results, CallerContext caller, boolean useCaching) {
        if (results.isEmpty()) {
            log.info("No authorized documents, skipping generation");
            return GeneratedAnswer.builder()
                    .text(NO_RESULTS_MESSAGE)
                    .build();
        }

        String key = PromptCache.keyFor(promptTemplate, caller.getGroups());
        PromptArtifact artifact = null;
        boolean cached = false;

        if (useCaching) {
            Optional<PromptArtifact> hit = promptCache.get(key);
            if (hit.isPresent()) {
                artifact = hit.get();
                cached = true;
            }
        }
        if (artifact == null) {
            artifact = buildArtifact(key, caller);
            if (useCaching) {
                promptCache.put(key, artifact);
            }
        }

        String userTurn = buildContext(results.getDocuments()) + "\nQuestion: " + query;
        CompletionResult completion = generativeModel.complete(
                artifact.getSystemPrompt(), List.of(ChatMessage.user(userTurn)), useCaching);

        log.info("Generated answer from {} documents (prompt cached: {}, cached tokens: {})",
                results.getDocuments().size(), cached, completion.getUsage().getCachedTokens());

        return GeneratedAnswer.builder()
                .text(completion.getText())
                .citations(buildCitations(results.getDocuments()))
                .cached(cached)
                .usage(completion.getUsage())
                .build();
    }

    private PromptArtifact buildArtifact(String key, CallerContext caller) {
        String groups = caller.getGroups().isEmpty() ? "none" : String.join(", ", caller.getGroups());
        return new PromptArtifact(promptTemplate.replace(GROUPS_PLACEHOLDER, groups), key, clock.instant());
    }

    String buildContext(List<ScoredDocument> documents) {
        StringBuilder context = new StringBuilder();

        for (int i = 0; i < documents.size(); i++) {
            ScoredDocument doc = documents.get(i);

            context.append("---\n");
            context.append("Document ").append(i + 1)
                    .append(" (").append(doc.getSourceKind() != null ? doc.getSourceKind().label() : "Unknown").append("):\n");
            context.append("Title: ").append(doc.getTitle()).append("\n");
            context.append("Source: ").append(doc.getSourceUri()).append("\n");

            Map<String, Object> metadata = metadataSanitizer.sanitize(doc.getMetadata());
            for (Map.Entry<String, Object> entry : metadata.entrySet()) {
                context.append(entry.getKey()).append(": ").append(entry.getValue()).append("\n");
            }
            context.append("\nContent:\n");
            context.append(truncate(doc.getContent()));
            context.append("\n---\n\n");
        }

        return context.toString();
    }

    private List<Citation> buildCitations(List<ScoredDocument> documents) {
        List<Citation> citations = new ArrayList<>();
        for (int i = 0; i < documents.size(); i++) {
            ScoredDocument doc = documents.get(i);
            citations.add(Citation.builder()
                    .index(i + 1)
                    .label(doc.getSourceKind() != null ? doc.getSourceKind().label() : "")
                    .title(doc.getTitle())
                    .sourceUri(doc.getSourceUri())
                    .content(truncate(doc.getContent()))
                    .metadata(metadataSanitizer.sanitize(doc.getMetadata()))
                    .score(doc.getScore())
                    .sourceKind(doc.getSourceKind())
                    .build());
        }
        return citations;
    }

    private String truncate(String content) {
        if (content.length() <= MAX_CONTENT_CHARS) {
            return content;
        }
        return content.substring(0, MAX_CONTENT_CHARS) + "...";
    }
}
