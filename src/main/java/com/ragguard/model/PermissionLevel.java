package com.ragguard.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Permission detail recorded for a single principal of a structured ACL
 */
@Value
public class PermissionLevel {

    public enum Inheritance { DIRECT, INHERITED }

    public enum PrincipalType { USER, GROUP, ROLE }

    public enum Access { ALLOW, DENY }

    Set<String> permissions;
    Inheritance inheritance;
    PrincipalType principalType;
    Access access;

    @Builder
    private PermissionLevel(Collection<String> permissions, Inheritance inheritance,
                            PrincipalType principalType, Access access) {
        TreeSet<String> copy = new TreeSet<>();
        if (permissions != null) {
            for (String permission : permissions) {
                if (permission != null && !permission.isBlank()) {
                    copy.add(permission.trim());
                }
            }
        }
        this.permissions = Collections.unmodifiableSet(copy);
        this.inheritance = inheritance != null ? inheritance : Inheritance.INHERITED;
        this.principalType = principalType != null ? principalType : PrincipalType.USER;
        this.access = access != null ? access : Access.ALLOW;
    }

    /**
     * True when any permission matches one of the given names, ignoring case
     */
    public boolean hasAnyPermission(Set<String> lowerCaseNames) {
        for (String permission : permissions) {
            if (lowerCaseNames.contains(permission.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
