package com.ragguard.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.ragguard.acl.AclNormalizer;
import com.ragguard.backend.GenerativeModel;
import com.ragguard.backend.KeywordIndex;
import com.ragguard.backend.KeywordIndexAdapter;
import com.ragguard.backend.VectorRetriever;
import com.ragguard.backend.VectorStoreAdapter;
import com.ragguard.exception.ValidationException;
import com.ragguard.model.AccessPredicate;
import com.ragguard.model.CompletionResult;
import com.ragguard.model.GatewayRequest;
import com.ragguard.model.GatewayResponse;
import com.ragguard.model.RetrievedItem;
import com.ragguard.model.ScoredDocument;
import com.ragguard.model.SourceKind;
import com.ragguard.model.TokenUsage;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class RetrievalOrchestratorTest {

    private VectorRetriever vectorRetriever;
    private KeywordIndex keywordIndex;
    private GenerativeModel generativeModel;
    private ExecutorService executor;
    private RetrievalOrchestrator orchestrator;

    @BeforeEach
    void setUp() throws IOException {
        Clock clock = Clock.fixed(Instant.parse("2024-04-01T09:00:00Z"), ZoneOffset.UTC);
        vectorRetriever = mock(VectorRetriever.class);
        keywordIndex = mock(KeywordIndex.class);
        generativeModel = mock(GenerativeModel.class);
        executor = Executors.newFixedThreadPool(4);

        when(keywordIndex.supportsAttributeFilter()).thenReturn(true);
        when(keywordIndex.query(anyString(), any(), any(), anyInt())).thenReturn(List.of());
        when(vectorRetriever.query(anyString(), any(), anyInt())).thenReturn(List.of());

        AclNormalizer aclNormalizer = new AclNormalizer();
        MetadataSanitizer sanitizer = new MetadataSanitizer();
        AnswerGenerator answerGenerator = new AnswerGenerator(generativeModel,
                new PromptCache(Duration.ofMinutes(60), clock), sanitizer, clock);
        ReflectionTestUtils.setField(answerGenerator, "promptTemplate", "Groups: {{groups}}");

        orchestrator = new RetrievalOrchestrator(
                new AccessFilterCompiler(),
                List.of(new VectorStoreAdapter(vectorRetriever, aclNormalizer),
                        new KeywordIndexAdapter(keywordIndex, aclNormalizer)),
                new HybridResultMerger(),
                answerGenerator,
                sanitizer,
                executor,
                clock);
        ReflectionTestUtils.setField(orchestrator, "backendTimeoutMs", 500L);
        ReflectionTestUtils.setField(orchestrator, "defaultMaxResults", 10);
        ReflectionTestUtils.setField(orchestrator, "maxResultsCap", 50);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static ScoredDocument doc(String id, double score, Map<String, Object> metadata) {
        return ScoredDocument.builder()
                .id(id)
                .title("Doc " + id)
                .content("content " + id)
                .score(score)
                .metadata(metadata)
                .build();
    }

    private static GatewayRequest request(String type) {
        return GatewayRequest.builder()
                .query("Q1 revenue")
                .userId("a@x.com")
                .userGroups(List.of("finance"))
                .type(type)
                .build();
    }

    @Nested
    @DisplayName("Q1 revenue scenario")
    class ScenarioTest {

        @BeforeEach
        void stubCandidates() throws IOException {
            when(vectorRetriever.query(anyString(), any(), anyInt())).thenReturn(List.of(
                    doc("public-report", 0.62, Map.of("classification", "public")),
                    doc("finance-forecast", 0.91, Map.of("classification", "confidential", "access_groups", List.of("finance"))),
                    doc("legal-memo", 0.97, Map.of("classification", "confidential", "access_groups", List.of("legal")))));
        }

        @Test
        @DisplayName("Should return only the public and finance documents by descending score")
        void shouldReturnAuthorizedDocuments() {
            GatewayResponse response = orchestrator.handle(request("retrieve"));

            assertThat(response.getType()).isEqualTo("retrieve");
            assertThat(response.getResults()).extracting(RetrievedItem::getId)
                    .containsExactly("finance-forecast", "public-report");
            assertThat(response.getTotalResults()).isEqualTo(2);
            assertThat(response.getResults().get(0).getSourceKind()).isEqualTo(SourceKind.PRIMARY_STORE);
            assertThat(response.getResults().get(0).getMetadata()).doesNotContainKey("access_groups");
            assertThat(response.getBackends()).containsOnlyKeys("knowledge_base", "search_index");
            assertThat(response.getTimestamp()).isEqualTo("2024-04-01T09:00:00Z");
        }

        @Test
        @DisplayName("Should generate an answer citing only authorized documents")
        void shouldGenerateAnswer() {
            when(generativeModel.complete(anyString(), anyList(), anyBoolean()))
                    .thenReturn(new CompletionResult("Q1 revenue was up [1].", TokenUsage.NONE));

            GatewayResponse response = orchestrator.handle(request("retrieve_and_generate"));

            assertThat(response.getGeneratedResponse()).isEqualTo("Q1 revenue was up [1].");
            assertThat(response.getCitations()).hasSize(2);
            assertThat(response.getCached()).isFalse();
            assertThat(response.getResults()).isNull();
        }
    }

    @Test
    @DisplayName("Should reject a caller without identity before querying any backend")
    void shouldValidateIdentityFirst() {
        GatewayRequest request = GatewayRequest.builder().query("Q1 revenue").build();

        assertThatThrownBy(() -> orchestrator.handle(request))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Either user_id or user_groups must be provided");
        verifyNoInteractions(vectorRetriever, keywordIndex);
    }

    @Test
    @DisplayName("Should reject a blank query")
    void shouldRejectBlankQuery() {
        GatewayRequest request = GatewayRequest.builder().query("  ").userId("a@x.com").build();

        assertThatThrownBy(() -> orchestrator.handle(request))
                .isInstanceOf(ValidationException.class)
                .hasMessage(RetrievalOrchestrator.MISSING_QUERY_MESSAGE);
    }

    @Test
    @DisplayName("Should return the no-results answer without calling the model when every backend fails")
    void shouldDegradeWhenBackendsFail() throws IOException {
        when(vectorRetriever.query(anyString(), any(), anyInt())).thenThrow(new IOException("knowledge base down"));
        when(keywordIndex.query(anyString(), any(), any(), anyInt())).thenThrow(new IOException("solr down"));

        GatewayResponse response = orchestrator.handle(request("retrieve_and_generate"));

        assertThat(response.getGeneratedResponse()).isEqualTo(AnswerGenerator.NO_RESULTS_MESSAGE);
        assertThat(response.getBackends().get("knowledge_base").getError()).isEqualTo("knowledge base down");
        assertThat(response.getBackends().get("search_index").getError()).isEqualTo("solr down");
        verify(generativeModel, never()).complete(anyString(), anyList(), anyBoolean());
    }

    @Test
    @DisplayName("Should record a slow backend as timed out and keep the other results")
    void shouldTimeOutSlowBackend() throws IOException {
        when(vectorRetriever.query(anyString(), any(), anyInt())).thenAnswer(invocation -> {
            Thread.sleep(3000);
            return List.of();
        });
        when(keywordIndex.query(anyString(), any(AccessPredicate.class), isNull(), anyInt()))
                .thenReturn(List.of(doc("s1", 3.2, Map.of("access_users", "a@x.com"))));

        GatewayResponse response = orchestrator.handle(request("retrieve"));

        assertThat(response.getResults()).extracting(RetrievedItem::getId).containsExactly("s1");
        assertThat(response.getBackends().get("knowledge_base").getError()).startsWith("Timed out");
        assertThat(response.getResults().get(0).getSourceKind()).isEqualTo(SourceKind.SECONDARY_INDEX);
    }

    @Test
    @DisplayName("Should query only the selected sources")
    void shouldHonourSourceSelection() throws IOException {
        GatewayRequest request = request("retrieve");
        request.setSources(List.of("search_index", "unknown"));

        GatewayResponse response = orchestrator.handle(request);

        assertThat(response.getBackends()).containsOnlyKeys("search_index");
        verifyNoInteractions(vectorRetriever);
    }

    @Test
    @DisplayName("Should clamp max_results to the configured cap")
    void shouldClampMaxResults() throws IOException {
        GatewayRequest request = request("retrieve");
        request.setMaxResults(500);

        orchestrator.handle(request);

        verify(vectorRetriever).query(eq("Q1 revenue"), any(), eq(50));
    }
}
