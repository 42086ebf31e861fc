package com.ragguard.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Canonical allow/deny sets governing document visibility.
 *
 * <p>Instances are frozen at construction: every set is trimmed, deduplicated and
 * unmodifiable, so two policies built from the same principals are equal regardless
 * of input order. A principal listed in both an allow and a deny set is denied.
 */
@Value
public class AccessPolicy {

    private static final AccessPolicy EMPTY = new AccessPolicy(null, null, null, null, null);

    Set<String> allowedUsers;
    Set<String> allowedGroups;
    Set<String> deniedUsers;
    Set<String> deniedGroups;
    Map<String, PermissionLevel> permissionLevels;

    @Builder
    private AccessPolicy(Collection<String> allowedUsers,
                         Collection<String> allowedGroups,
                         Collection<String> deniedUsers,
                         Collection<String> deniedGroups,
                         Map<String, PermissionLevel> permissionLevels) {
        this.allowedUsers = freeze(allowedUsers);
        this.allowedGroups = freeze(allowedGroups);
        this.deniedUsers = freeze(deniedUsers);
        this.deniedGroups = freeze(deniedGroups);
        this.permissionLevels = permissionLevels == null || permissionLevels.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(permissionLevels));
    }

    public static AccessPolicy empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return allowedUsers.isEmpty() && allowedGroups.isEmpty()
                && deniedUsers.isEmpty() && deniedGroups.isEmpty()
                && permissionLevels.isEmpty();
    }

    public boolean hasAllowData() {
        return !allowedUsers.isEmpty() || !allowedGroups.isEmpty();
    }

    /**
     * True when the user id or any of the groups appears in a deny set.
     * Matching ignores case so a deny entry cannot be sidestepped by casing.
     */
    public boolean denies(String userId, Collection<String> groups) {
        if (userId != null && containsIgnoreCase(deniedUsers, userId)) {
            return true;
        }
        if (groups != null) {
            for (String group : groups) {
                if (containsIgnoreCase(deniedGroups, group)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean containsIgnoreCase(Set<String> values, String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return false;
        }
        String trimmed = candidate.trim();
        for (String value : values) {
            if (value.equalsIgnoreCase(trimmed)) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> freeze(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return Collections.emptySet();
        }
        TreeSet<String> copy = new TreeSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                copy.add(value.trim());
            }
        }
        return Collections.unmodifiableSet(copy);
    }
}
