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
 * Secondary search index. Uses the attribute filter when the index supports one,
 * otherwise forwards the caller token and lets the index enforce access.
 */
@Order(2)
@Component
public class KeywordIndexAdapter extends AbstractQueryAdapter {

    public static final String NAME = "search_index";

    static final String MISSING_TOKEN_MESSAGE = "Skipped: index enforces access by caller token and none was supplied";

    private final KeywordIndex index;

    public KeywordIndexAdapter(KeywordIndex index, AclNormalizer aclNormalizer) {
        super(aclNormalizer);
        this.index = index;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public SourceKind sourceKind() {
        return SourceKind.SECONDARY_INDEX;
    }

    @Override
    public AuthorizationMode authorizationMode() {
        return index.supportsAttributeFilter() ? AuthorizationMode.PREDICATE : AuthorizationMode.TOKEN;
    }

    @Override
    protected List<ScoredDocument> fetch(String text, QueryScope scope, int limit) throws IOException {
        if (index.supportsAttributeFilter()) {
            return index.query(text, scope.getPredicate(), null, limit);
        }
        String token = scope.getCaller().getCallerToken();
        if (token == null) {
            throw new IllegalStateException(MISSING_TOKEN_MESSAGE);
        }
        return index.query(text, null, token, limit);
    }

    @Override
    public boolean isAvailable() {
        return index.isAvailable();
    }
}
