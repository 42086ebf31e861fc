package com.ragguard.backend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.ragguard.model.AccessCondition;
import com.ragguard.model.AccessPredicate;
import com.ragguard.model.ScoredDocument;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;

class KnowledgeBaseClientTest {

    private final KnowledgeBaseClient client = new KnowledgeBaseClient();

    @Test
    void shouldEmbedPredicateAsOrAllFilter() {
        AccessPredicate predicate = new AccessPredicate(List.of(
                AccessCondition.of(AccessCondition.Field.ACCESS_USERS, "a@x.com"),
                AccessCondition.of(AccessCondition.Field.CLASSIFICATION, "public")));

        JsonObject request = client.buildRetrieveRequest("Q1 revenue", predicate, 5);

        assertThat(request.getAsJsonObject("retrievalQuery").get("text").getAsString()).isEqualTo("Q1 revenue");
        JsonObject vectorSearch = request.getAsJsonObject("retrievalConfiguration")
                .getAsJsonObject("vectorSearchConfiguration");
        assertThat(vectorSearch.get("numberOfResults").getAsInt()).isEqualTo(5);
        JsonArray orAll = vectorSearch.getAsJsonObject("filter").getAsJsonArray("orAll");
        assertThat(orAll).hasSize(2);
        JsonObject first = orAll.get(0).getAsJsonObject().getAsJsonObject("equals");
        assertThat(first.get("key").getAsString()).isEqualTo("access_users");
        assertThat(first.get("value").getAsString()).isEqualTo("a@x.com");
    }

    @Test
    void shouldOmitFilterWithoutPredicate() {
        JsonObject request = client.buildRetrieveRequest("anything", null, 3);

        assertThat(request.getAsJsonObject("retrievalConfiguration")
                .getAsJsonObject("vectorSearchConfiguration").has("filter")).isFalse();
    }

    @Test
    void shouldParseRetrievalResults() {
        String body = """
                {"retrievalResults":[
                  {"content":{"text":"Q1 revenue grew 12%"},
                   "location":{"s3Location":{"uri":"s3://kb/synced-content/Q1_a1b2c3d4.txt"}},
                   "score":0.82,
                   "metadata":{"source_id":"a1b2c3d4","title":"Q1 Forecast","access_groups":"finance"}},
                  {"content":{"text":"Handbook"},
                   "location":{"s3Location":{"uri":"s3://kb/handbook.txt"}},
                   "score":0.4}
                ]}
                """;

        List<ScoredDocument> documents = client.parseRetrieveResponse(body);

        assertThat(documents).hasSize(2);
        ScoredDocument first = documents.get(0);
        assertThat(first.getId()).isEqualTo("a1b2c3d4");
        assertThat(first.getTitle()).isEqualTo("Q1 Forecast");
        assertThat(first.getSourceUri()).isEqualTo("s3://kb/synced-content/Q1_a1b2c3d4.txt");
        assertThat(first.getScore()).isEqualTo(0.82);
        assertThat(first.getMetadata()).containsEntry("access_groups", "finance");

        assertThat(documents.get(1).getId()).isEqualTo("s3://kb/handbook.txt");
        assertThat(documents.get(1).getMetadata()).isEmpty();
    }

    @Test
    void shouldReturnNothingForEmptyBody() {
        assertThat(client.parseRetrieveResponse("{}")).isEmpty();
    }

    @Test
    void shouldFailQueryWhenNotConfigured() {
        assertThat(client.isAvailable()).isFalse();
        assertThatThrownBy(() -> client.query("q", null, 5))
                .isInstanceOf(IOException.class)
                .hasMessage("Knowledge base is not configured");
    }
}
