package com.ragguard.service;

import com.ragguard.exception.ValidationException;
import com.ragguard.model.AccessCondition;
import com.ragguard.model.AccessPredicate;
import com.ragguard.model.CallerContext;
import com.ragguard.model.Classification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the allow-only authorization predicate for a caller.
 *
 * <p>Conditions are OR'd, so their order only affects readability: direct user access,
 * creator, one condition per group, then the public-classification fallback.
 */
@Slf4j
@Service
public class AccessFilterCompiler {

    public static final String MISSING_IDENTITY_MESSAGE = "Either user_id or user_groups must be provided";

    public AccessPredicate compile(CallerContext caller) {
        if (caller == null || !caller.hasIdentity()) {
            throw new ValidationException(MISSING_IDENTITY_MESSAGE);
        }

        List<AccessCondition> conditions = new ArrayList<>();

        if (caller.hasUserId()) {
            conditions.add(AccessCondition.of(AccessCondition.Field.ACCESS_USERS, caller.getUserId()));
            conditions.add(AccessCondition.of(AccessCondition.Field.CREATED_BY, caller.getUserId()));
        }

        for (String group : caller.getGroups()) {
            conditions.add(AccessCondition.of(AccessCondition.Field.ACCESS_GROUPS, group));
        }

        conditions.add(AccessCondition.of(AccessCondition.Field.CLASSIFICATION, Classification.PUBLIC.value()));

        AccessPredicate predicate = new AccessPredicate(conditions);
        log.debug("Built access predicate with {} conditions for user {} and {} groups",
                conditions.size(), caller.getUserId(), caller.getGroups().size());
        return predicate;
    }
}
