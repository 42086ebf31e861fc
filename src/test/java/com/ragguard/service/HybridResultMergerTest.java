package com.ragguard.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ragguard.model.AccessPolicy;
import com.ragguard.model.AccessPredicate;
import com.ragguard.model.AuthorizationMode;
import com.ragguard.model.BackendResult;
import com.ragguard.model.CallerContext;
import com.ragguard.model.MergedResultSet;
import com.ragguard.model.ScoredDocument;
import com.ragguard.model.SourceKind;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HybridResultMergerTest {

    private final HybridResultMerger merger = new HybridResultMerger();
    private final AccessFilterCompiler compiler = new AccessFilterCompiler();

    private final CallerContext alice = CallerContext.of("alice", List.of("finance"));
    private final AccessPredicate predicate = compiler.compile(alice);

    private static ScoredDocument doc(String id, double score, Map<String, Object> metadata, AccessPolicy policy) {
        return ScoredDocument.builder()
                .id(id)
                .title(id)
                .content("content of " + id)
                .score(score)
                .metadata(metadata)
                .accessPolicy(policy)
                .build();
    }

    private static BackendResult result(String name, SourceKind kind, AuthorizationMode mode, ScoredDocument... docs) {
        return BackendResult.builder()
                .backendName(name)
                .sourceKind(kind)
                .authorizationMode(mode)
                .documents(List.of(docs))
                .build();
    }

    @Test
    @DisplayName("Should drop documents denying the caller even when they are public")
    void shouldApplyDenyOverPublic() {
        ScoredDocument denied = doc("d1", 0.9, Map.of("classification", "public"),
                AccessPolicy.builder().deniedGroups(List.of("FINANCE")).build());
        ScoredDocument visible = doc("d2", 0.5, Map.of("classification", "public"), AccessPolicy.empty());

        MergedResultSet merged = merger.merge(List.of(
                result("knowledge_base", SourceKind.PRIMARY_STORE, AuthorizationMode.PREDICATE, denied, visible)),
                alice, predicate, 10);

        assertThat(merged.getDocuments()).extracting(ScoredDocument::getId).containsExactly("d2");
        assertThat(merged.getTotalCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep public documents for a caller with no matching grants")
    void shouldKeepPublicDocuments() {
        ScoredDocument publicDoc = doc("p1", 0.4, Map.of("classification", "public", "access_groups", "legal"),
                AccessPolicy.builder().allowedGroups(List.of("legal")).build());

        MergedResultSet merged = merger.merge(List.of(
                result("knowledge_base", SourceKind.PRIMARY_STORE, AuthorizationMode.PREDICATE, publicDoc)),
                alice, predicate, 10);

        assertThat(merged.getDocuments()).hasSize(1);
    }

    @Test
    @DisplayName("Should re-check the allow predicate only for predicate-mode backends")
    void shouldRecheckAllowForPredicateModeOnly() {
        Map<String, Object> foreign = Map.of("access_groups", "legal", "classification", "internal");
        ScoredDocument fromStore = doc("k1", 0.8, foreign, AccessPolicy.empty());
        ScoredDocument fromTokenIndex = doc("s1", 0.7, foreign, AccessPolicy.empty());

        MergedResultSet merged = merger.merge(List.of(
                result("knowledge_base", SourceKind.PRIMARY_STORE, AuthorizationMode.PREDICATE, fromStore),
                result("search_index", SourceKind.SECONDARY_INDEX, AuthorizationMode.TOKEN, fromTokenIndex)),
                alice, predicate, 10);

        assertThat(merged.getDocuments()).extracting(ScoredDocument::getId).containsExactly("s1");
    }

    @Test
    @DisplayName("Should accept a direct grant in the policy when metadata lacks canonical fields")
    void shouldAcceptPolicyGrant() {
        ScoredDocument legacy = doc("l1", 0.3, Map.of("allowed_users", List.of("alice")),
                AccessPolicy.builder().allowedUsers(List.of("alice")).build());

        MergedResultSet merged = merger.merge(List.of(
                result("search_index", SourceKind.SECONDARY_INDEX, AuthorizationMode.PREDICATE, legacy)),
                alice, predicate, 10);

        assertThat(merged.getDocuments()).hasSize(1);
    }

    @Test
    @DisplayName("Should drop every copy of a document when one backend's copy denies the caller")
    void shouldApplyDenyAcrossBackends() {
        ScoredDocument deniedCopy = doc("X", 0.6, Map.of("classification", "public"),
                AccessPolicy.builder().deniedUsers(List.of("alice")).build());
        ScoredDocument bareCopy = doc("X", 5.0, Map.of(), AccessPolicy.empty());
        ScoredDocument other = doc("Y", 1.0, Map.of(), AccessPolicy.empty());

        MergedResultSet merged = merger.merge(List.of(
                result("knowledge_base", SourceKind.PRIMARY_STORE, AuthorizationMode.PREDICATE, deniedCopy),
                result("search_index", SourceKind.SECONDARY_INDEX, AuthorizationMode.TOKEN, bareCopy, other)),
                alice, predicate, 10);

        assertThat(merged.getDocuments()).extracting(ScoredDocument::getId).containsExactly("Y");
        assertThat(merged.getProvenance().get("search_index").getRetained()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should accept a public classification regardless of its casing")
    void shouldMatchPublicIgnoringCase() {
        ScoredDocument handbook = doc("h1", 0.5, Map.of("classification", "Public"), AccessPolicy.empty());

        MergedResultSet merged = merger.merge(List.of(
                result("knowledge_base", SourceKind.PRIMARY_STORE, AuthorizationMode.PREDICATE, handbook)),
                alice, predicate, 10);

        assertThat(merged.getDocuments()).extracting(ScoredDocument::getId).containsExactly("h1");
    }

    @Test
    @DisplayName("Should deduplicate by id, sort stably by score and truncate")
    void shouldDeduplicateSortAndTruncate() {
        Map<String, Object> granted = Map.of("access_users", "alice");
        ScoredDocument a = doc("a", 0.5, granted, AccessPolicy.empty());
        ScoredDocument b = doc("b", 0.9, granted, AccessPolicy.empty());
        ScoredDocument c = doc("c", 0.5, granted, AccessPolicy.empty());
        ScoredDocument duplicateB = doc("b", 12.0, granted, AccessPolicy.empty());
        ScoredDocument d = doc("d", 0.1, granted, AccessPolicy.empty());

        MergedResultSet merged = merger.merge(List.of(
                result("knowledge_base", SourceKind.PRIMARY_STORE, AuthorizationMode.PREDICATE, a, b),
                result("search_index", SourceKind.SECONDARY_INDEX, AuthorizationMode.PREDICATE, c, duplicateB, d)),
                alice, predicate, 3);

        assertThat(merged.getDocuments()).extracting(ScoredDocument::getId).containsExactly("b", "a", "c");
        assertThat(merged.getDocuments().get(0).getScore()).isEqualTo(0.9);
        assertThat(merged.getTotalCount()).isEqualTo(4);
        assertThat(merged.getProvenance().get("knowledge_base").getReturned()).isEqualTo(2);
        assertThat(merged.getProvenance().get("knowledge_base").getRetained()).isEqualTo(2);
        assertThat(merged.getProvenance().get("search_index").getReturned()).isEqualTo(3);
        assertThat(merged.getProvenance().get("search_index").getRetained()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should carry failed backends into provenance")
    void shouldRecordFailures() {
        BackendResult failed = BackendResult.failed("search_index", SourceKind.SECONDARY_INDEX,
                AuthorizationMode.PREDICATE, "connection refused", 5);

        MergedResultSet merged = merger.merge(List.of(failed), alice, predicate, 10);

        assertThat(merged.isEmpty()).isTrue();
        assertThat(merged.getProvenance().get("search_index").getError()).isEqualTo("connection refused");
    }
}
