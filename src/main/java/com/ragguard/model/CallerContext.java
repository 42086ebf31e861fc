package com.ragguard.model;

import lombok.Value;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Identity of the caller for a single request
 */
@Value
public class CallerContext {

    String userId;
    Set<String> groups;
    String callerToken;

    private CallerContext(String userId, Collection<String> groups, String callerToken) {
        this.userId = userId == null || userId.isBlank() ? null : userId.trim();
        TreeSet<String> copy = new TreeSet<>();
        if (groups != null) {
            for (String group : groups) {
                if (group != null && !group.isBlank()) {
                    copy.add(group.trim());
                }
            }
        }
        this.groups = Collections.unmodifiableSet(copy);
        this.callerToken = callerToken == null || callerToken.isBlank() ? null : callerToken;
    }

    public static CallerContext of(String userId, Collection<String> groups) {
        return new CallerContext(userId, groups, null);
    }

    public static CallerContext of(String userId, Collection<String> groups, String callerToken) {
        return new CallerContext(userId, groups, callerToken);
    }

    public boolean hasUserId() {
        return userId != null;
    }

    public boolean hasIdentity() {
        return userId != null || !groups.isEmpty();
    }
}
