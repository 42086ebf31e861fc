package com.ragguard.backend;

import com.ragguard.model.AuthorizationMode;
import com.ragguard.model.BackendResult;
import com.ragguard.model.SourceKind;

/**
 * Uniform query surface over one retrieval backend
 */
public interface BackendQueryAdapter {

    String name();

    SourceKind sourceKind();

    AuthorizationMode authorizationMode();

    /**
     * Never throws. A failing backend yields an empty result carrying an error annotation.
     */
    BackendResult query(String text, QueryScope scope, int limit);

    boolean isAvailable();
}
