package com.ragguard.acl;

import com.ragguard.model.AccessPolicy;
import com.ragguard.model.PermissionLevel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable collector used by the parsers before a policy is frozen
 */
class PolicyAccumulator {

    private final List<String> allowedUsers = new ArrayList<>();
    private final List<String> allowedGroups = new ArrayList<>();
    private final List<String> deniedUsers = new ArrayList<>();
    private final List<String> deniedGroups = new ArrayList<>();
    private final Map<String, PermissionLevel> permissionLevels = new LinkedHashMap<>();

    void add(AclTarget target, String principal) {
        if (principal == null || principal.isBlank()) {
            return;
        }
        switch (target) {
            case ALLOWED_USERS -> allowedUsers.add(principal);
            case ALLOWED_GROUPS -> allowedGroups.add(principal);
            case DENIED_USERS -> deniedUsers.add(principal);
            case DENIED_GROUPS -> deniedGroups.add(principal);
        }
    }

    void addAll(AclTarget target, List<String> principals) {
        for (String principal : principals) {
            add(target, principal);
        }
    }

    /**
     * A deny level already recorded for the principal is never replaced by an allow level
     */
    void recordLevel(String principal, PermissionLevel level) {
        PermissionLevel existing = permissionLevels.get(principal);
        if (existing != null && existing.getAccess() == PermissionLevel.Access.DENY
                && level.getAccess() == PermissionLevel.Access.ALLOW) {
            return;
        }
        permissionLevels.put(principal, level);
    }

    boolean isEmpty() {
        return allowedUsers.isEmpty() && allowedGroups.isEmpty()
                && deniedUsers.isEmpty() && deniedGroups.isEmpty()
                && permissionLevels.isEmpty();
    }

    AccessPolicy freeze() {
        return AccessPolicy.builder()
                .allowedUsers(allowedUsers)
                .allowedGroups(allowedGroups)
                .deniedUsers(deniedUsers)
                .deniedGroups(deniedGroups)
                .permissionLevels(permissionLevels)
                .build();
    }
}
