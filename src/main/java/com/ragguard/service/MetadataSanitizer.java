package com.ragguard.service;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Strips access-control and internal bookkeeping attributes from response-bound metadata
 */
@Component
public class MetadataSanitizer {

    static final String INTERNAL_PREFIX = "internal_";

    static final Set<String> SENSITIVE_KEYS = Set.of(
            "access_users", "access_groups", "denied_users", "denied_groups",
            "internal_id", "processing_metadata",
            "acl_v2", "sharepoint_acl_v2",
            "allowed_users", "allowed_groups",
            "sharepoint_allowed_users", "sharepoint_allowed_groups",
            "sharepoint_denied_users", "sharepoint_denied_groups",
            "allowed_principals", "allowed_principal", "principals", "readers",
            "denied_principals", "denied_principal");

    public Map<String, Object> sanitize(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> sanitized = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : metadata.entrySet()) {
            String key = entry.getKey();
            if (SENSITIVE_KEYS.contains(key) || key.startsWith(INTERNAL_PREFIX)) {
                continue;
            }
            sanitized.put(key, entry.getValue());
        }
        return sanitized;
    }
}
