package com.ragguard.backend;

import com.ragguard.model.AccessPredicate;
import com.ragguard.model.ScoredDocument;

import java.io.IOException;
import java.util.List;

/**
 * Vector knowledge store that accepts an attribute filter with each query
 */
public interface VectorRetriever {

    List<ScoredDocument> query(String text, AccessPredicate filter, int limit) throws IOException;

    boolean isAvailable();
}
