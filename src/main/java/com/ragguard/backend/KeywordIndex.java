package com.ragguard.backend;

import com.ragguard.model.AccessPredicate;
import com.ragguard.model.ScoredDocument;
import com.ragguard.model.SourceDocument;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Keyword search index. Depending on the implementation, authorization is either an
 * attribute filter pushed with the query or an opaque caller token checked by the index.
 */
public interface KeywordIndex {

    /**
     * True when {@link #query} honours the attribute filter; false when it relies on the caller token
     */
    boolean supportsAttributeFilter();

    /**
     * @param filter      attribute filter, used when {@link #supportsAttributeFilter()} is true
     * @param callerToken opaque caller token, used otherwise
     */
    List<ScoredDocument> query(String text, AccessPredicate filter, String callerToken, int limit)
            throws IOException;

    /**
     * Every document in the index, for ingestion sync
     */
    List<SourceDocument> listDocuments() throws IOException;

    /**
     * Raw access-control attributes of a document; empty when the document is unknown
     */
    Map<String, Object> getDocumentAcl(String id) throws IOException;

    boolean isAvailable();
}
