package com.ragguard.backend;

import com.ragguard.acl.AclNormalizer;
import com.ragguard.model.AuthorizationMode;
import com.ragguard.model.ScoredDocument;
import com.ragguard.model.SourceKind;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Primary knowledge store; the access predicate is pushed down as a metadata filter
 */
@Order(1)
@Component
public class VectorStoreAdapter extends AbstractQueryAdapter {

    public static final String NAME = "knowledge_base";

    private final VectorRetriever retriever;

    public VectorStoreAdapter(VectorRetriever retriever, AclNormalizer aclNormalizer) {
        super(aclNormalizer);
        this.retriever = retriever;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public SourceKind sourceKind() {
        return SourceKind.PRIMARY_STORE;
    }

    @Override
    public AuthorizationMode authorizationMode() {
        return AuthorizationMode.PREDICATE;
    }

    @Override
    protected List<ScoredDocument> fetch(String text, QueryScope scope, int limit) throws IOException {
        return retriever.query(text, scope.getPredicate(), limit);
    }

    @Override
    public boolean isAvailable() {
        return retriever.isAvailable();
    }
}
