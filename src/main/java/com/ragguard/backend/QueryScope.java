package com.ragguard.backend;

import com.ragguard.model.AccessPredicate;
import com.ragguard.model.CallerContext;
import lombok.Value;

/**
 * Caller identity and compiled predicate for one query
 */
@Value
public class QueryScope {
    CallerContext caller;
    AccessPredicate predicate;
}
