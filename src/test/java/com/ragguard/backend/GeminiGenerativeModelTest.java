package com.ragguard.backend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.ragguard.exception.UpstreamGenerationException;
import com.ragguard.model.ChatMessage;
import com.ragguard.model.CompletionResult;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class GeminiGenerativeModelTest {

    private GeminiGenerativeModel model;

    @BeforeEach
    void setUp() {
        model = new GeminiGenerativeModel();
        ReflectionTestUtils.setField(model, "temperature", 0.3);
        ReflectionTestUtils.setField(model, "maxOutputTokens", 2048);
    }

    @Test
    void shouldSendInstructionAsSystemInstructionWhenCaching() {
        JsonObject request = model.buildRequest("Answer from context.", List.of(ChatMessage.user("Q1 revenue?")), true);

        assertThat(request.getAsJsonObject("systemInstruction").getAsJsonArray("parts")
                .get(0).getAsJsonObject().get("text").getAsString()).isEqualTo("Answer from context.");
        JsonArray contents = request.getAsJsonArray("contents");
        assertThat(contents).hasSize(1);
        assertThat(contents.get(0).getAsJsonObject().get("role").getAsString()).isEqualTo("user");
        assertThat(contents.get(0).getAsJsonObject().getAsJsonArray("parts")
                .get(0).getAsJsonObject().get("text").getAsString()).isEqualTo("Q1 revenue?");
        assertThat(request.getAsJsonObject("generationConfig").get("maxOutputTokens").getAsInt()).isEqualTo(2048);
    }

    @Test
    void shouldPrependInstructionToFirstUserTurnWithoutCaching() {
        JsonObject request = model.buildRequest("Answer from context.", List.of(
                ChatMessage.user("first"),
                new ChatMessage(ChatMessage.Role.MODEL, "reply"),
                ChatMessage.user("second")), false);

        assertThat(request.has("systemInstruction")).isFalse();
        JsonArray contents = request.getAsJsonArray("contents");
        assertThat(text(contents, 0)).isEqualTo("Answer from context.\n\nfirst");
        assertThat(contents.get(1).getAsJsonObject().get("role").getAsString()).isEqualTo("model");
        assertThat(text(contents, 2)).isEqualTo("second");
    }

    @Test
    void shouldJoinCandidatePartsAndReadUsage() {
        String body = """
                {"candidates":[{"content":{"parts":[{"text":"Revenue "},{"text":"grew [1]."}]}}],
                 "usageMetadata":{"promptTokenCount":812,"candidatesTokenCount":9,"cachedContentTokenCount":640}}
                """;

        CompletionResult result = model.parseResponse(body);

        assertThat(result.getText()).isEqualTo("Revenue grew [1].");
        assertThat(result.getUsage().getPromptTokens()).isEqualTo(812);
        assertThat(result.getUsage().getOutputTokens()).isEqualTo(9);
        assertThat(result.getUsage().getCachedTokens()).isEqualTo(640);
    }

    @Test
    void shouldFailOnResponseWithoutCandidates() {
        assertThatThrownBy(() -> model.parseResponse("{\"candidates\":[]}"))
                .isInstanceOf(UpstreamGenerationException.class)
                .hasMessage("Gemini returned no candidates");
    }

    @Test
    void shouldReportMalformedBodiesAsGenerationFailures() {
        assertThatThrownBy(() -> model.parseResponse("<html>Service Unavailable</html>"))
                .isInstanceOf(UpstreamGenerationException.class)
                .hasMessageStartingWith("Unreadable Gemini response");
        assertThatThrownBy(() -> model.parseResponse("{\"candidates\":{\"content\":\"oops\"}}"))
                .isInstanceOf(UpstreamGenerationException.class);
        assertThatThrownBy(() -> model.parseResponse("{\"candidates\":[{\"content\":{\"parts\":[{\"text\":{\"a\":1}}]}}]}"))
                .isInstanceOf(UpstreamGenerationException.class);
    }

    @Test
    void shouldRefuseToCallWithoutApiKey() {
        ReflectionTestUtils.setField(model, "apiKey", "");

        assertThat(model.isAvailable()).isFalse();
        assertThatThrownBy(() -> model.complete("x", List.of(ChatMessage.user("y")), true))
                .isInstanceOf(UpstreamGenerationException.class);
    }

    private static String text(JsonArray contents, int index) {
        return contents.get(index).getAsJsonObject().getAsJsonArray("parts")
                .get(0).getAsJsonObject().get("text").getAsString();
    }
}
