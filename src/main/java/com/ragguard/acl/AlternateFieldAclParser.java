package com.ragguard.acl;

import com.ragguard.model.AccessPolicy;
import com.ragguard.util.AttributeValues;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Last-resort parser for connectors that publish a flat list of principals.
 * Entries prefixed {@code group:}, {@code g:} or {@code role:} are groups; everything else is a user.
 */
public class AlternateFieldAclParser implements AclParser {

    public static final List<String> ALLOW_FIELDS = List.of("allowed_principals", "principals", "readers", "allowed_principal");
    static final List<String> DENY_FIELDS = List.of("denied_principals", "denied_principal");

    public static final String GROUP_PREFIX = "group:";

    private static final List<String> GROUP_PREFIXES = List.of(GROUP_PREFIX, "g:", "role:");
    private static final List<String> USER_PREFIXES = List.of("user:", "u:");

    @Override
    public AclEncoding encoding() {
        return AclEncoding.ALTERNATE_FIELDS;
    }

    @Override
    public Optional<AccessPolicy> parse(Map<String, Object> attributes) {
        PolicyAccumulator accumulator = new PolicyAccumulator();
        for (String field : ALLOW_FIELDS) {
            for (String principal : AttributeValues.toStringList(attributes.get(field))) {
                addPrincipal(accumulator, principal, AclTarget.ALLOWED_USERS, AclTarget.ALLOWED_GROUPS);
            }
        }
        for (String field : DENY_FIELDS) {
            for (String principal : AttributeValues.toStringList(attributes.get(field))) {
                addPrincipal(accumulator, principal, AclTarget.DENIED_USERS, AclTarget.DENIED_GROUPS);
            }
        }
        return accumulator.isEmpty() ? Optional.empty() : Optional.of(accumulator.freeze());
    }

    private void addPrincipal(PolicyAccumulator accumulator, String principal,
                              AclTarget userTarget, AclTarget groupTarget) {
        String lower = principal.toLowerCase(Locale.ROOT);
        for (String prefix : GROUP_PREFIXES) {
            if (lower.startsWith(prefix)) {
                accumulator.add(groupTarget, principal.substring(prefix.length()).trim());
                return;
            }
        }
        for (String prefix : USER_PREFIXES) {
            if (lower.startsWith(prefix)) {
                accumulator.add(userTarget, principal.substring(prefix.length()).trim());
                return;
            }
        }
        accumulator.add(userTarget, principal);
    }
}
