package com.ragguard.service;

import com.ragguard.acl.AclNormalizer;
import com.ragguard.acl.NormalizedAcl;
import com.ragguard.backend.KeywordIndex;
import com.ragguard.backend.KnowledgeBaseIngestion;
import com.ragguard.backend.ObjectStore;
import com.ragguard.model.AccessPolicy;
import com.ragguard.model.Classification;
import com.ragguard.model.ClassificationResult;
import com.ragguard.model.SourceDocument;
import com.ragguard.model.StagedDocument;
import com.ragguard.model.SyncReport;
import com.ragguard.util.AttributeValues;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Copies documents from the secondary search index into object storage with canonical
 * access-control metadata, then starts an ingestion job on the knowledge base
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionSyncService {

    static final String CONTENT_TYPE = "text/plain";

    private final KeywordIndex keywordIndex;
    private final AclNormalizer aclNormalizer;
    private final ClassificationService classificationService;
    private final ObjectStore objectStore;
    private final KnowledgeBaseIngestion knowledgeBaseIngestion;
    private final Clock clock;

    @Value("${sync.enabled:false}")
    private boolean syncEnabled;

    @Value("${sync.prefix:synced-content}")
    private String syncPrefix;

    @Value("${sync.source-name:enterprise_search}")
    private String sourceName;

    private final AtomicBoolean syncInProgress = new AtomicBoolean(false);

    @Scheduled(fixedDelayString = "${sync.interval-ms:3600000}", initialDelayString = "${sync.initial-delay-ms:60000}")
    public void scheduledSync() {
        if (!syncEnabled) {
            return;
        }
        if (syncInProgress.get()) {
            log.info("Sync already in progress, skipping scheduled sync");
            return;
        }
        syncDocuments();
    }

    public SyncReport syncDocuments() {
        if (!syncInProgress.compareAndSet(false, true)) {
            log.info("Sync already in progress");
            return SyncReport.skipped();
        }

        try {
            log.info("Starting document synchronization...");

            List<SourceDocument> documents;
            try {
                documents = keywordIndex.listDocuments();
            } catch (IOException e) {
                log.error("Could not list source documents: {}", e.getMessage(), e);
                return SyncReport.builder()
                        .executed(true)
                        .error("Could not list source documents: " + e.getMessage())
                        .build();
            }

            int staged = 0;
            int skipped = 0;
            int failed = 0;

            for (SourceDocument document : documents) {
                if (document.getContent() == null || document.getContent().isBlank()) {
                    log.debug("Skipping document without content: {}", document.getId());
                    skipped++;
                    continue;
                }
                try {
                    StagedDocument stagedDocument = stage(document);
                    objectStore.put(stagedDocument.getObjectKey(),
                            stagedDocument.getBody().getBytes(StandardCharsets.UTF_8),
                            CONTENT_TYPE, stagedDocument.getMetadata());
                    staged++;
                    log.info("Staged: {} ({}, {})", stagedDocument.getObjectKey(),
                            stagedDocument.getClassification().getClassification().value(),
                            stagedDocument.getClassification().getDepartment());
                } catch (IOException | RuntimeException e) {
                    failed++;
                    log.warn("Failed to stage document {}: {}", document.getId(), e.getMessage());
                }
            }

            String jobId = null;
            if (staged > 0) {
                try {
                    jobId = knowledgeBaseIngestion
                            .startIngestion("Sync of " + staged + " documents at " + clock.instant())
                            .orElse(null);
                    log.info("Started ingestion job: {}", jobId);
                } catch (IOException e) {
                    log.error("Failed to start ingestion job: {}", e.getMessage(), e);
                }
            }

            log.info("Sync completed. Found: {}, Staged: {}, Skipped: {}, Failed: {}",
                    documents.size(), staged, skipped, failed);

            return SyncReport.builder()
                    .documentsFound(documents.size())
                    .documentsStaged(staged)
                    .documentsSkipped(skipped)
                    .documentsFailed(failed)
                    .ingestionJobId(jobId)
                    .executed(true)
                    .build();

        } finally {
            syncInProgress.set(false);
        }
    }

    public boolean isSyncInProgress() {
        return syncInProgress.get();
    }

    /**
     * Builds the canonical staged form of a source document
     */
    StagedDocument stage(SourceDocument document) throws IOException {
        Map<String, Object> attributes = document.getAttributes() != null
                ? document.getAttributes()
                : Collections.emptyMap();

        AccessPolicy policy = resolvePolicy(document.getId(), attributes);
        String uri = document.getUri() != null ? document.getUri() : "";
        String title = document.getTitle() != null ? document.getTitle() : "";

        ClassificationResult classification = classificationService.classify(
                policy, pathHint(attributes, uri), filenameHint(attributes, uri, title));
        Optional<Classification> explicit = Classification.fromValue(
                AttributeValues.firstString(attributes.get("classification"), ""));
        if (explicit.isPresent()) {
            classification = ClassificationResult.builder()
                    .classification(explicit.get())
                    .department(AttributeValues.firstString(attributes.get("department"), classification.getDepartment()))
                    .createdBy(classification.getCreatedBy())
                    .basis(classification.getBasis())
                    .build();
        }

        String today = LocalDate.now(clock).toString();
        String author = attribute(attributes, "", "author", "Author");

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("source", attribute(attributes, sourceName, "source"));
        metadata.put("source_type", attribute(attributes, "document", "source_type"));
        metadata.put("source_uri", uri);
        metadata.put("source_id", document.getId());
        metadata.put("title", title);
        metadata.put("content_type", attribute(attributes, "Document", "content_type", "ContentType"));
        metadata.put("created_date", attribute(attributes, today, "created_date", "Created"));
        metadata.put("modified_date", attribute(attributes, today, "modified_date", "Modified"));
        metadata.put("author", author);
        metadata.put("created_by", classification.getCreatedBy() != null
                ? classification.getCreatedBy()
                : attribute(attributes, author, "created_by"));
        metadata.put("access_users", AttributeValues.join(policy.getAllowedUsers()));
        metadata.put("access_groups", AttributeValues.join(policy.getAllowedGroups()));
        metadata.put("denied_users", AttributeValues.join(policy.getDeniedUsers()));
        metadata.put("denied_groups", AttributeValues.join(policy.getDeniedGroups()));
        metadata.put("classification", classification.getClassification().value());
        metadata.put("department", classification.getDepartment());
        metadata.put("site", siteOf(uri, attributes));
        metadata.put("list", attribute(attributes, "", "list", "List"));
        metadata.put("library", attribute(attributes, "", "library", "Library"));

        return StagedDocument.builder()
                .objectKey(syncPrefix + "/" + fileName(title, document.getId()))
                .body(header(metadata) + "\n\n" + document.getContent())
                .metadata(metadata)
                .accessPolicy(policy)
                .classification(classification)
                .build();
    }

    private AccessPolicy resolvePolicy(String id, Map<String, Object> attributes) throws IOException {
        Optional<NormalizedAcl> listed = aclNormalizer.detect(attributes);
        if (listed.isPresent()) {
            return listed.get().getPolicy();
        }
        return aclNormalizer.normalize(keywordIndex.getDocumentAcl(id));
    }

    static String header(Map<String, String> metadata) {
        String site = metadata.getOrDefault("site", "");
        return String.join("\n",
                "Title: " + metadata.getOrDefault("title", ""),
                "Source: " + metadata.getOrDefault("source", "") + (site.isEmpty() ? "" : " (" + site + ")"),
                "Author: " + metadata.getOrDefault("author", ""),
                "Created: " + metadata.getOrDefault("created_date", ""),
                "Modified: " + metadata.getOrDefault("modified_date", ""),
                "Department: " + metadata.getOrDefault("department", ""),
                "Classification: " + metadata.getOrDefault("classification", ""),
                "---");
    }

    /**
     * Title reduced to letters, digits, spaces, dashes and underscores, plus the first 8 id characters
     */
    static String fileName(String title, String id) {
        StringBuilder clean = new StringBuilder();
        for (char c : title.toCharArray()) {
            if (Character.isLetterOrDigit(c) || c == ' ' || c == '-' || c == '_') {
                clean.append(c);
            }
        }
        String cleanTitle = clean.toString().trim().replace(' ', '_');
        if (cleanTitle.isEmpty()) {
            cleanTitle = "document";
        }
        String safeId = id == null ? "unknown" : id;
        return cleanTitle + "_" + safeId.substring(0, Math.min(8, safeId.length())) + ".txt";
    }

    static String siteOf(String uri, Map<String, Object> attributes) {
        int index = uri.indexOf("/sites/");
        if (index >= 0) {
            String rest = uri.substring(index + "/sites/".length());
            int slash = rest.indexOf('/');
            String site = slash >= 0 ? rest.substring(0, slash) : rest;
            if (!site.isEmpty()) {
                return site;
            }
        }
        return AttributeValues.firstString(attributes.get("site"), "unknown");
    }

    private String pathHint(Map<String, Object> attributes, String uri) {
        String path = AttributeValues.firstString(attributes.get("path"), "");
        if (!path.isEmpty()) {
            return path;
        }
        return uriPath(uri);
    }

    private String filenameHint(Map<String, Object> attributes, String uri, String title) {
        String fileName = AttributeValues.firstString(attributes.get("file_name"), "");
        if (!fileName.isEmpty()) {
            return fileName;
        }
        String path = uriPath(uri);
        int slash = path.lastIndexOf('/');
        String lastSegment = slash >= 0 ? path.substring(slash + 1) : path;
        return lastSegment.isEmpty() ? title : lastSegment;
    }

    private String uriPath(String uri) {
        if (uri.isEmpty()) {
            return "";
        }
        try {
            String path = URI.create(uri).getPath();
            return path != null ? path : "";
        } catch (IllegalArgumentException e) {
            log.debug("Unparseable document URI {}: {}", uri, e.getMessage());
            return "";
        }
    }

    private String attribute(Map<String, Object> attributes, String fallback, String... names) {
        for (String name : names) {
            String value = AttributeValues.firstString(attributes.get(name), "");
            if (!value.isEmpty()) {
                return value;
            }
        }
        return fallback;
    }
}
