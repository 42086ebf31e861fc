package com.ragguard.backend;

import com.ragguard.acl.AclTarget;
import com.ragguard.acl.AlternateFieldAclParser;
import com.ragguard.acl.LegacyAclParser;
import com.ragguard.model.AccessCondition;
import com.ragguard.model.AccessPredicate;
import com.ragguard.model.ScoredDocument;
import com.ragguard.model.SourceDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrQuery;
import org.apache.solr.client.solrj.SolrServerException;
import org.apache.solr.client.solrj.response.QueryResponse;
import org.apache.solr.client.solrj.util.ClientUtils;
import org.apache.solr.common.SolrDocument;
import org.apache.solr.common.SolrDocumentList;
import org.apache.solr.common.params.CursorMarkParams;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keyword index on Apache Solr. Access is enforced with a filter query built from the predicate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SolrKeywordIndex implements KeywordIndex {

    static final String FIELD_ID = "id";
    static final String FIELD_TITLE = "title";
    static final String FIELD_CONTENT = "content";
    static final String FIELD_URL = "url";

    // Returned as document text or bookkeeping, never as metadata
    private static final Set<String> NON_METADATA_FIELDS = Set.of(FIELD_CONTENT, "score", "_version_");

    private final SolrClient solrClient;

    @Value("${solr.min-score:0.0}")
    private float minScore;

    @Value("${solr.boost.title:10.0}")
    private float titleBoost;

    @Value("${solr.boost.content:1.0}")
    private float contentBoost;

    @Value("${solr.page-size:100}")
    private int pageSize;

    @Override
    public boolean supportsAttributeFilter() {
        return true;
    }

    @Override
    public List<ScoredDocument> query(String text, AccessPredicate filter, String callerToken, int limit)
            throws IOException {
        SolrQuery solrQuery = new SolrQuery();
        solrQuery.setParam("defType", "edismax");
        solrQuery.setQuery(escapeQueryChars(text));
        solrQuery.setParam("qf", String.format("%s^%.1f %s^%.1f", FIELD_TITLE, titleBoost, FIELD_CONTENT, contentBoost));
        solrQuery.setParam("pf", FIELD_TITLE + "^20 " + FIELD_CONTENT + "^5");
        solrQuery.setParam("mm", "50%");
        solrQuery.setRows(limit);
        solrQuery.setFields("*", "score");
        if (filter != null) {
            solrQuery.addFilterQuery(toFilterQuery(filter));
        }

        QueryResponse response = execute(solrQuery);
        SolrDocumentList results = response.getResults();

        List<ScoredDocument> documents = new ArrayList<>();
        for (SolrDocument solrDoc : results) {
            Object score = solrDoc.getFieldValue("score");
            float value = score instanceof Number ? ((Number) score).floatValue() : 0f;
            if (value < minScore) {
                continue;
            }
            documents.add(ScoredDocument.builder()
                    .id(getStringField(solrDoc, FIELD_ID))
                    .title(getStringField(solrDoc, FIELD_TITLE))
                    .sourceUri(getStringField(solrDoc, FIELD_URL))
                    .content(getStringField(solrDoc, FIELD_CONTENT))
                    .score(value)
                    .metadata(metadataOf(solrDoc))
                    .build());
        }

        log.debug("Solr search found {} of {} documents", documents.size(), results.getNumFound());
        return documents;
    }

    /**
     * Walks the whole index with a cursor
     */
    @Override
    public List<SourceDocument> listDocuments() throws IOException {
        List<SourceDocument> documents = new ArrayList<>();
        String cursorMark = CursorMarkParams.CURSOR_MARK_START;

        while (true) {
            SolrQuery solrQuery = new SolrQuery("*:*");
            solrQuery.setRows(pageSize);
            solrQuery.setSort(FIELD_ID, SolrQuery.ORDER.asc);
            solrQuery.set(CursorMarkParams.CURSOR_MARK_PARAM, cursorMark);

            QueryResponse response = execute(solrQuery);
            for (SolrDocument solrDoc : response.getResults()) {
                documents.add(SourceDocument.builder()
                        .id(getStringField(solrDoc, FIELD_ID))
                        .title(getStringField(solrDoc, FIELD_TITLE))
                        .uri(getStringField(solrDoc, FIELD_URL))
                        .content(getStringField(solrDoc, FIELD_CONTENT))
                        .attributes(metadataOf(solrDoc))
                        .build());
            }

            String nextCursorMark = response.getNextCursorMark();
            if (nextCursorMark == null || nextCursorMark.equals(cursorMark)) {
                break;
            }
            cursorMark = nextCursorMark;
        }

        log.info("Listed {} documents from Solr", documents.size());
        return documents;
    }

    @Override
    public Map<String, Object> getDocumentAcl(String id) throws IOException {
        try {
            SolrDocument solrDoc = solrClient.getById(id);
            return solrDoc == null ? Collections.emptyMap() : metadataOf(solrDoc);
        } catch (SolrServerException e) {
            throw new IOException("Solr lookup failed for document " + id, e);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            SolrQuery query = new SolrQuery("*:*");
            query.setRows(0);
            solrClient.query(query);
            return true;
        } catch (Exception e) {
            log.error("Solr health check failed: {}", e.getMessage());
            return false;
        }
    }

    public long getDocumentCount() {
        try {
            SolrQuery query = new SolrQuery("*:*");
            query.setRows(0);
            return solrClient.query(query).getResults().getNumFound();
        } catch (SolrServerException | IOException e) {
            log.error("Error getting document count: {}", e.getMessage(), e);
            return 0;
        }
    }

    /**
     * Renders the predicate as one OR'd filter query, e.g.
     * {@code access_users:alice OR allowed_users:alice OR ... OR classification:public}.
     * User and group grants are matched on every flat allow field the index may carry:
     * the canonical staged fields, the legacy connector lists and the principal lists.
     * Structured JSON ACLs cannot be filtered in Solr.
     */
    static String toFilterQuery(AccessPredicate predicate) {
        Set<String> clauses = new LinkedHashSet<>();
        for (AccessCondition condition : predicate.getConditions()) {
            String value = condition.getValue();
            switch (condition.getField()) {
                case ACCESS_USERS -> {
                    addClause(clauses, condition.getField().key(), value);
                    for (String field : LegacyAclParser.fieldsFor(AclTarget.ALLOWED_USERS)) {
                        addClause(clauses, field, value);
                    }
                    for (String field : AlternateFieldAclParser.ALLOW_FIELDS) {
                        addClause(clauses, field, value);
                    }
                }
                case ACCESS_GROUPS -> {
                    addClause(clauses, condition.getField().key(), value);
                    for (String field : LegacyAclParser.fieldsFor(AclTarget.ALLOWED_GROUPS)) {
                        addClause(clauses, field, value);
                    }
                    for (String field : AlternateFieldAclParser.ALLOW_FIELDS) {
                        addClause(clauses, field, AlternateFieldAclParser.GROUP_PREFIX + value);
                    }
                }
                default -> addClause(clauses, condition.getField().key(), value);
            }
        }
        return String.join(" OR ", clauses);
    }

    private static void addClause(Set<String> clauses, String field, String value) {
        clauses.add(field + ":" + ClientUtils.escapeQueryChars(value));
    }

    private QueryResponse execute(SolrQuery solrQuery) throws IOException {
        try {
            return solrClient.query(solrQuery);
        } catch (SolrServerException e) {
            throw new IOException("Solr query failed: " + e.getMessage(), e);
        }
    }

    private Map<String, Object> metadataOf(SolrDocument solrDoc) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        for (String field : solrDoc.getFieldNames()) {
            if (NON_METADATA_FIELDS.contains(field)) {
                continue;
            }
            Object value = solrDoc.getFieldValue(field);
            if (value instanceof Collection) {
                value = new ArrayList<>((Collection<?>) value);
            }
            metadata.put(field, value);
        }
        return metadata;
    }

    /**
     * Escapes query syntax but keeps whitespace so edismax still sees separate terms
     */
    private String escapeQueryChars(String query) {
        StringBuilder sb = new StringBuilder();
        for (char c : query.toCharArray()) {
            if (c == '\\' || c == '+' || c == '-' || c == '!' || c == '(' || c == ')'
                || c == ':' || c == '^' || c == '[' || c == ']' || c == '\"'
                || c == '{' || c == '}' || c == '~' || c == '?' || c == '|'
                || c == '&' || c == ';' || c == '/') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private String getStringField(SolrDocument doc, String field) {
        Object value = doc.getFieldValue(field);
        if (value == null) return "";
        if (value instanceof Collection) {
            Collection<?> col = (Collection<?>) value;
            return col.isEmpty() ? "" : col.iterator().next().toString();
        }
        return value.toString();
    }
}
