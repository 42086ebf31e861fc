package com.ragguard.acl;

/**
 * Canonical policy set an attribute feeds into
 */
public enum AclTarget {
    ALLOWED_USERS,
    ALLOWED_GROUPS,
    DENIED_USERS,
    DENIED_GROUPS
}
