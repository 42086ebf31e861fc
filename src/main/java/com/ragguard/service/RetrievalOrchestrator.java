package com.ragguard.service;

import com.ragguard.backend.BackendQueryAdapter;
import com.ragguard.backend.QueryScope;
import com.ragguard.exception.ValidationException;
import com.ragguard.model.AccessPredicate;
import com.ragguard.model.BackendResult;
import com.ragguard.model.CallerContext;
import com.ragguard.model.GatewayRequest;
import com.ragguard.model.GatewayResponse;
import com.ragguard.model.GeneratedAnswer;
import com.ragguard.model.MergedResultSet;
import com.ragguard.model.RetrievalType;
import com.ragguard.model.RetrievedItem;
import com.ragguard.model.ScoredDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Query path: validate, compile the access predicate, fan out to backends, merge,
 * and optionally generate an answer
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetrievalOrchestrator {

    public static final String MISSING_QUERY_MESSAGE = "Query parameter is required";

    private final AccessFilterCompiler accessFilterCompiler;
    private final List<BackendQueryAdapter> adapters;
    private final HybridResultMerger resultMerger;
    private final AnswerGenerator answerGenerator;
    private final MetadataSanitizer metadataSanitizer;
    private final ExecutorService backendExecutor;
    private final Clock clock;

    @Value("${gateway.backend-timeout-ms:10000}")
    private long backendTimeoutMs;

    @Value("${gateway.default-max-results:10}")
    private int defaultMaxResults;

    @Value("${gateway.max-results-cap:50}")
    private int maxResultsCap;

    public GatewayResponse handle(GatewayRequest request) {
        if (request == null || request.getQuery() == null || request.getQuery().isBlank()) {
            throw new ValidationException(MISSING_QUERY_MESSAGE);
        }
        String query = request.getQuery().trim();

        CallerContext caller = CallerContext.of(request.getUserId(), request.getUserGroups(), request.getUserToken());
        AccessPredicate predicate = accessFilterCompiler.compile(caller);

        RetrievalType type = RetrievalType.fromValue(request.getType());
        int limit = clampLimit(request.getMaxResults());
        log.info("Processing {} query: {} (user: {}, groups: {}, limit: {})",
                type.value(), truncate(query, 100), caller.getUserId(), caller.getGroups().size(), limit);

        List<BackendResult> backendResults = queryBackends(query, new QueryScope(caller, predicate),
                selectAdapters(request.getSources()), limit);
        MergedResultSet merged = resultMerger.merge(backendResults, caller, predicate, limit);
        log.info("Merged {} authorized documents, returning {}", merged.getTotalCount(), merged.getDocuments().size());

        GatewayResponse.GatewayResponseBuilder response = GatewayResponse.builder()
                .type(type.value())
                .query(query)
                .backends(merged.getProvenance())
                .timestamp(clock.instant().toString());

        if (type == RetrievalType.RETRIEVE_AND_GENERATE) {
            boolean useCaching = request.getUseCaching() == null || request.getUseCaching();
            GeneratedAnswer answer = answerGenerator.generate(query, merged, caller, useCaching);
            return response
                    .generatedResponse(answer.getText())
                    .citations(answer.getCitations())
                    .cached(answer.isCached())
                    .build();
        }

        List<RetrievedItem> items = new ArrayList<>();
        for (ScoredDocument document : merged.getDocuments()) {
            items.add(RetrievedItem.builder()
                    .id(document.getId())
                    .title(document.getTitle())
                    .content(document.getContent())
                    .score(document.getScore())
                    .sourceUri(document.getSourceUri())
                    .sourceKind(document.getSourceKind())
                    .metadata(metadataSanitizer.sanitize(document.getMetadata()))
                    .build());
        }
        return response
                .results(items)
                .totalResults(items.size())
                .build();
    }

    /**
     * Queries every selected backend in parallel. A backend that fails or exceeds the
     * timeout contributes a failed result; the call itself is left to finish on its own.
     */
    List<BackendResult> queryBackends(String query, QueryScope scope, List<BackendQueryAdapter> selected, int limit) {
        List<CompletableFuture<BackendResult>> futures = new ArrayList<>();
        for (BackendQueryAdapter adapter : selected) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> adapter.query(query, scope, limit), backendExecutor)
                    .orTimeout(backendTimeoutMs, TimeUnit.MILLISECONDS)
                    .exceptionally(e -> failedResult(adapter, e)));
        }

        List<BackendResult> results = new ArrayList<>();
        for (CompletableFuture<BackendResult> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    private BackendResult failedResult(BackendQueryAdapter adapter, Throwable e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        String error = cause instanceof TimeoutException
                ? "Timed out after " + backendTimeoutMs + "ms"
                : String.valueOf(cause.getMessage());
        log.warn("Backend {} failed: {}", adapter.name(), error);
        return BackendResult.failed(adapter.name(), adapter.sourceKind(), adapter.authorizationMode(),
                error, backendTimeoutMs);
    }

    /**
     * Matches adapter names and source kinds, ignoring case, keeping adapter order.
     * No usable selection means every adapter.
     */
    List<BackendQueryAdapter> selectAdapters(List<String> sources) {
        if (sources == null || sources.isEmpty()) {
            return adapters;
        }
        Set<String> wanted = new HashSet<>();
        for (String source : sources) {
            if (source == null || source.isBlank()) {
                continue;
            }
            String name = source.trim().toLowerCase(Locale.ROOT);
            boolean known = adapters.stream().anyMatch(a -> matches(a, name));
            if (known) {
                wanted.add(name);
            } else {
                log.warn("Ignoring unknown source: {}", source);
            }
        }
        List<BackendQueryAdapter> selected = new ArrayList<>();
        for (BackendQueryAdapter adapter : adapters) {
            if (wanted.stream().anyMatch(name -> matches(adapter, name))) {
                selected.add(adapter);
            }
        }
        return selected.isEmpty() ? adapters : selected;
    }

    private boolean matches(BackendQueryAdapter adapter, String name) {
        return adapter.name().equals(name) || adapter.sourceKind().name().toLowerCase(Locale.ROOT).equals(name);
    }

    private int clampLimit(Integer requested) {
        int limit = requested == null ? defaultMaxResults : requested;
        return Math.max(1, Math.min(limit, maxResultsCap));
    }

    private String truncate(String str, int maxLength) {
        if (str == null) return "";
        if (str.length() <= maxLength) return str;
        return str.substring(0, maxLength) + "...";
    }
}
