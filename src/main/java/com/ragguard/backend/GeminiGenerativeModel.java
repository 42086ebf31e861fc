package com.ragguard.backend;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.ragguard.exception.UpstreamGenerationException;
import com.ragguard.model.ChatMessage;
import com.ragguard.model.CompletionResult;
import com.ragguard.model.TokenUsage;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Generative model on the Gemini REST API
 */
@Slf4j
@Service
public class GeminiGenerativeModel implements GenerativeModel {

    @Value("${gemini.api-key:}")
    private String apiKey;

    @Value("${gemini.model:gemini-2.0-flash}")
    private String model;

    @Value("${gemini.temperature:0.3}")
    private double temperature;

    @Value("${gemini.max-output-tokens:2048}")
    private int maxOutputTokens;

    @Value("${gemini.timeout-ms:60000}")
    private long timeoutMs;

    @Value("${gemini.base-url:https://generativelanguage.googleapis.com/v1beta}")
    private String baseUrl;

    private OkHttpClient httpClient;
    private final Gson gson = new Gson();

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    @PostConstruct
    public void init() {
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .build();

        if (!isAvailable()) {
            log.warn("Gemini API key not configured");
        } else {
            log.info("Gemini generative model initialized: {}", model);
        }
    }

    @Override
    public CompletionResult complete(String systemPrompt, List<ChatMessage> messages, boolean cacheHint) {
        if (!isAvailable()) {
            throw new UpstreamGenerationException("Gemini API key not configured");
        }

        JsonObject requestBody = buildRequest(systemPrompt, messages, cacheHint);
        Request request = new Request.Builder()
                .url(baseUrl + "/models/" + model + ":generateContent")
                .header("x-goog-api-key", apiKey)
                .post(RequestBody.create(gson.toJson(requestBody), JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                String errorBody = response.body() != null ? response.body().string() : "Unknown error";
                log.error("Gemini API error: {} - {}", response.code(), errorBody);
                throw new UpstreamGenerationException("Gemini API error: " + response.code());
            }
            return parseResponse(response.body() != null ? response.body().string() : "");

        } catch (IOException e) {
            log.error("Gemini call failed: {}", e.getMessage());
            throw new UpstreamGenerationException("Gemini call failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isEmpty();
    }

    /**
     * With the cache hint the instruction travels as {@code systemInstruction}, an identical
     * prefix the provider can reuse across calls. Without it the instruction is prepended
     * to the first user turn.
     */
    JsonObject buildRequest(String systemPrompt, List<ChatMessage> messages, boolean cacheHint) {
        JsonObject requestBody = new JsonObject();

        JsonArray contents = new JsonArray();
        boolean instructionPending = !cacheHint && systemPrompt != null && !systemPrompt.isEmpty();
        for (ChatMessage message : messages) {
            String text = message.getText();
            if (instructionPending && message.getRole() == ChatMessage.Role.USER) {
                text = systemPrompt + "\n\n" + text;
                instructionPending = false;
            }
            contents.add(content(message.getRole() == ChatMessage.Role.MODEL ? "model" : "user", text));
        }
        requestBody.add("contents", contents);

        if (cacheHint && systemPrompt != null && !systemPrompt.isEmpty()) {
            JsonObject instruction = new JsonObject();
            instruction.add("parts", parts(systemPrompt));
            requestBody.add("systemInstruction", instruction);
        }

        JsonObject generationConfig = new JsonObject();
        generationConfig.addProperty("temperature", temperature);
        generationConfig.addProperty("maxOutputTokens", maxOutputTokens);
        requestBody.add("generationConfig", generationConfig);

        return requestBody;
    }

    CompletionResult parseResponse(String responseBody) {
        try {
            return readCompletion(responseBody);
        } catch (JsonParseException | IllegalStateException | ClassCastException | UnsupportedOperationException e) {
            log.error("Unreadable Gemini response: {}", e.getMessage());
            throw new UpstreamGenerationException("Unreadable Gemini response: " + e.getMessage(), e);
        }
    }

    private CompletionResult readCompletion(String responseBody) {
        JsonObject jsonResponse = gson.fromJson(responseBody, JsonObject.class);
        if (jsonResponse == null) {
            throw new UpstreamGenerationException("Empty Gemini response");
        }

        JsonArray candidates = jsonResponse.getAsJsonArray("candidates");
        if (candidates == null || candidates.size() == 0) {
            throw new UpstreamGenerationException("Gemini returned no candidates");
        }
        JsonObject content = candidates.get(0).getAsJsonObject().getAsJsonObject("content");
        if (content == null || !content.has("parts")) {
            throw new UpstreamGenerationException("Gemini candidate has no content");
        }
        StringBuilder text = new StringBuilder();
        for (JsonElement part : content.getAsJsonArray("parts")) {
            JsonElement partText = part.getAsJsonObject().get("text");
            if (partText != null && !partText.isJsonNull()) {
                text.append(partText.getAsString());
            }
        }

        TokenUsage usage = TokenUsage.NONE;
        if (jsonResponse.has("usageMetadata")) {
            JsonObject usageMetadata = jsonResponse.getAsJsonObject("usageMetadata");
            usage = new TokenUsage(
                    intMember(usageMetadata, "promptTokenCount"),
                    intMember(usageMetadata, "candidatesTokenCount"),
                    intMember(usageMetadata, "cachedContentTokenCount"));
        }
        return new CompletionResult(text.toString(), usage);
    }

    private JsonObject content(String role, String text) {
        JsonObject content = new JsonObject();
        content.addProperty("role", role);
        content.add("parts", parts(text));
        return content;
    }

    private JsonArray parts(String text) {
        JsonArray parts = new JsonArray();
        JsonObject textPart = new JsonObject();
        textPart.addProperty("text", text);
        parts.add(textPart);
        return parts;
    }

    private int intMember(JsonObject object, String name) {
        JsonElement element = object.get(name);
        return element == null || element.isJsonNull() ? 0 : element.getAsInt();
    }
}
