package com.ragguard.backend;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.reflect.TypeToken;
import com.ragguard.model.AccessPredicate;
import com.ragguard.model.ScoredDocument;
import com.ragguard.util.AttributeValues;
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
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * HTTP client for the vector knowledge base: filtered retrieval and ingestion jobs
 */
@Slf4j
@Service
public class KnowledgeBaseClient implements VectorRetriever, KnowledgeBaseIngestion {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
    private static final Type METADATA_TYPE = new TypeToken<Map<String, Object>>() { }.getType();

    @Value("${vector.endpoint:}")
    private String endpoint;

    @Value("${vector.knowledge-base-id:}")
    private String knowledgeBaseId;

    @Value("${vector.data-source-id:}")
    private String dataSourceId;

    @Value("${vector.api-key:}")
    private String apiKey;

    @Value("${vector.timeout-ms:30000}")
    private long timeoutMs;

    private OkHttpClient httpClient;
    private final Gson gson = new Gson();

    @PostConstruct
    public void init() {
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .build();

        if (!isAvailable()) {
            log.warn("Knowledge base endpoint or id not configured");
        } else {
            log.info("Knowledge base client initialized for {}", knowledgeBaseId);
        }
    }

    @Override
    public List<ScoredDocument> query(String text, AccessPredicate filter, int limit) throws IOException {
        if (!isAvailable()) {
            throw new IOException("Knowledge base is not configured");
        }
        String url = endpoint + "/knowledgebases/" + knowledgeBaseId + "/retrieve";
        String responseBody = post(url, buildRetrieveRequest(text, filter, limit));
        return parseRetrieveResponse(responseBody);
    }

    @Override
    public Optional<String> startIngestion(String description) throws IOException {
        if (!isAvailable() || dataSourceId == null || dataSourceId.isEmpty()) {
            log.warn("Knowledge base data source not configured, skipping ingestion job");
            return Optional.empty();
        }
        JsonObject body = new JsonObject();
        body.addProperty("description", description);

        String url = endpoint + "/knowledgebases/" + knowledgeBaseId
                + "/datasources/" + dataSourceId + "/ingestionjobs/";
        JsonObject response = gson.fromJson(put(url, body), JsonObject.class);

        if (response == null || !response.has("ingestionJob")) {
            return Optional.empty();
        }
        JsonElement jobId = response.getAsJsonObject("ingestionJob").get("ingestionJobId");
        return jobId == null || jobId.isJsonNull() ? Optional.empty() : Optional.of(jobId.getAsString());
    }

    @Override
    public boolean isAvailable() {
        return endpoint != null && !endpoint.isEmpty() && knowledgeBaseId != null && !knowledgeBaseId.isEmpty();
    }

    JsonObject buildRetrieveRequest(String text, AccessPredicate filter, int limit) {
        JsonObject retrievalQuery = new JsonObject();
        retrievalQuery.addProperty("text", text);

        JsonObject vectorSearch = new JsonObject();
        vectorSearch.addProperty("numberOfResults", limit);
        if (filter != null) {
            vectorSearch.add("filter", filter.toFilterJson());
        }

        JsonObject retrievalConfiguration = new JsonObject();
        retrievalConfiguration.add("vectorSearchConfiguration", vectorSearch);

        JsonObject requestBody = new JsonObject();
        requestBody.add("retrievalQuery", retrievalQuery);
        requestBody.add("retrievalConfiguration", retrievalConfiguration);
        return requestBody;
    }

    List<ScoredDocument> parseRetrieveResponse(String responseBody) {
        JsonObject jsonResponse = gson.fromJson(responseBody, JsonObject.class);
        if (jsonResponse == null || !jsonResponse.has("retrievalResults")) {
            return Collections.emptyList();
        }

        List<ScoredDocument> documents = new ArrayList<>();
        JsonArray results = jsonResponse.getAsJsonArray("retrievalResults");
        for (JsonElement element : results) {
            JsonObject result = element.getAsJsonObject();

            String text = "";
            if (result.has("content")) {
                JsonElement contentText = result.getAsJsonObject("content").get("text");
                text = contentText == null || contentText.isJsonNull() ? "" : contentText.getAsString();
            }

            Map<String, Object> metadata = result.has("metadata")
                    ? gson.fromJson(result.get("metadata"), METADATA_TYPE)
                    : Collections.emptyMap();
            if (metadata == null) {
                metadata = Collections.emptyMap();
            }

            String uri = locationUri(result);
            String id = AttributeValues.firstString(metadata.get("source_id"), "");
            if (id.isEmpty()) {
                id = uri.isEmpty() ? Integer.toHexString(text.hashCode()) : uri;
            }

            documents.add(ScoredDocument.builder()
                    .id(id)
                    .content(text)
                    .title(AttributeValues.firstString(metadata.get("title"), ""))
                    .sourceUri(AttributeValues.firstString(metadata.get("source_uri"), uri))
                    .score(result.has("score") ? result.get("score").getAsDouble() : 0.0)
                    .metadata(metadata)
                    .build());
        }
        return documents;
    }

    private String locationUri(JsonObject result) {
        if (!result.has("location")) {
            return "";
        }
        JsonObject location = result.getAsJsonObject("location");
        if (location.has("s3Location")) {
            JsonElement uri = location.getAsJsonObject("s3Location").get("uri");
            return uri == null || uri.isJsonNull() ? "" : uri.getAsString();
        }
        return "";
    }

    private String post(String url, JsonObject body) throws IOException {
        return execute(request(url).post(RequestBody.create(gson.toJson(body), JSON)).build());
    }

    private String put(String url, JsonObject body) throws IOException {
        return execute(request(url).put(RequestBody.create(gson.toJson(body), JSON)).build());
    }

    private Request.Builder request(String url) {
        Request.Builder builder = new Request.Builder().url(url);
        if (apiKey != null && !apiKey.isEmpty()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder;
    }

    private String execute(Request request) throws IOException {
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                String errorBody = response.body() != null ? response.body().string() : "Unknown error";
                log.error("Knowledge base error: {} - {}", response.code(), errorBody);
                throw new IOException("Knowledge base error: " + response.code());
            }
            return response.body() != null ? response.body().string() : "";
        }
    }
}
