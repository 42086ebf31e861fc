package com.ragguard.service;

import com.ragguard.model.AccessPolicy;
import com.ragguard.model.AccessPredicate;
import com.ragguard.model.AuthorizationMode;
import com.ragguard.model.BackendProvenance;
import com.ragguard.model.BackendResult;
import com.ragguard.model.CallerContext;
import com.ragguard.model.MergedResultSet;
import com.ragguard.model.ScoredDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Combines per-backend results into one authorized ranking.
 *
 * <p>Scores are compared as returned. Backends score on different scales, so a
 * mixed ranking favours whichever backend reports larger numbers.
 */
@Slf4j
@Service
public class HybridResultMerger {

    public MergedResultSet merge(List<BackendResult> results, CallerContext caller,
                                 AccessPredicate predicate, int limit) {
        List<ScoredDocument> authorized = new ArrayList<>();
        Map<ScoredDocument, String> origin = new IdentityHashMap<>();
        Set<String> seenIds = new HashSet<>();
        int denied = 0;
        int unmatched = 0;

        // A deny on any copy of a document removes every copy, whichever backend returned it
        Set<String> deniedIds = new HashSet<>();
        for (BackendResult result : results) {
            for (ScoredDocument document : result.getDocuments()) {
                if (document.getId() != null
                        && document.getAccessPolicy().denies(caller.getUserId(), caller.getGroups())) {
                    deniedIds.add(document.getId());
                }
            }
        }

        for (BackendResult result : results) {
            boolean recheckAllow = result.getAuthorizationMode() == AuthorizationMode.PREDICATE && predicate != null;
            for (ScoredDocument document : result.getDocuments()) {
                if (document.getAccessPolicy().denies(caller.getUserId(), caller.getGroups())
                        || (document.getId() != null && deniedIds.contains(document.getId()))) {
                    denied++;
                    continue;
                }
                if (recheckAllow && !isAllowed(document, caller, predicate)) {
                    unmatched++;
                    continue;
                }
                if (document.getId() != null && !seenIds.add(document.getId())) {
                    continue;
                }
                authorized.add(document);
                origin.put(document, result.getBackendName());
            }
        }

        // List.sort is stable: equal scores keep backend order
        authorized.sort(Comparator.comparingDouble(ScoredDocument::getScore).reversed());

        int totalCount = authorized.size();
        List<ScoredDocument> kept = authorized.size() > limit
                ? new ArrayList<>(authorized.subList(0, Math.max(limit, 0)))
                : authorized;

        Map<String, Integer> retained = new HashMap<>();
        for (ScoredDocument document : kept) {
            retained.merge(origin.get(document), 1, Integer::sum);
        }

        Map<String, BackendProvenance> provenance = new LinkedHashMap<>();
        for (BackendResult result : results) {
            provenance.put(result.getBackendName(), new BackendProvenance(
                    result.getSourceKind(),
                    result.getDocuments().size(),
                    retained.getOrDefault(result.getBackendName(), 0),
                    result.getError()));
        }

        if (denied > 0 || unmatched > 0) {
            log.info("Dropped {} denied and {} unauthorized documents", denied, unmatched);
        }

        return MergedResultSet.builder()
                .documents(List.copyOf(kept))
                .totalCount(totalCount)
                .provenance(provenance)
                .build();
    }

    /**
     * Post-hoc allow check: the predicate over the document metadata, or a direct grant in its policy
     */
    private boolean isAllowed(ScoredDocument document, CallerContext caller, AccessPredicate predicate) {
        if (predicate.matches(document.getMetadata())) {
            return true;
        }
        AccessPolicy policy = document.getAccessPolicy();
        if (caller.hasUserId() && policy.getAllowedUsers().contains(caller.getUserId())) {
            return true;
        }
        for (String group : caller.getGroups()) {
            if (policy.getAllowedGroups().contains(group)) {
                return true;
            }
        }
        return false;
    }
}
