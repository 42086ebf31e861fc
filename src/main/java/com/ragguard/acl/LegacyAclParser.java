package com.ragguard.acl;

import com.ragguard.model.AccessPolicy;
import com.ragguard.util.AttributeValues;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parses parallel allow/deny list fields. Every mapped field that is present contributes
 * to its target set; the canonical staged fields ({@code access_users} etc.) are read
 * the same way, so documents round-trip through staging unchanged.
 */
public class LegacyAclParser implements AclParser {

    static final List<AclFieldMapping> MAPPINGS = List.of(
            AclFieldMapping.of("allowed_users", AclTarget.ALLOWED_USERS),
            AclFieldMapping.of("allowed_groups", AclTarget.ALLOWED_GROUPS),
            AclFieldMapping.of("denied_users", AclTarget.DENIED_USERS),
            AclFieldMapping.of("denied_groups", AclTarget.DENIED_GROUPS),
            AclFieldMapping.of("sharepoint_allowed_users", AclTarget.ALLOWED_USERS),
            AclFieldMapping.of("sharepoint_allowed_groups", AclTarget.ALLOWED_GROUPS),
            AclFieldMapping.of("sharepoint_denied_users", AclTarget.DENIED_USERS),
            AclFieldMapping.of("sharepoint_denied_groups", AclTarget.DENIED_GROUPS),
            AclFieldMapping.of("access_users", AclTarget.ALLOWED_USERS),
            AclFieldMapping.of("access_groups", AclTarget.ALLOWED_GROUPS)
    );

    /**
     * Raw attribute names feeding one policy set, in mapping order
     */
    public static List<String> fieldsFor(AclTarget target) {
        List<String> fields = new ArrayList<>();
        for (AclFieldMapping mapping : MAPPINGS) {
            if (mapping.getTarget() == target) {
                fields.add(mapping.getFieldName());
            }
        }
        return fields;
    }

    @Override
    public AclEncoding encoding() {
        return AclEncoding.LEGACY;
    }

    @Override
    public Optional<AccessPolicy> parse(Map<String, Object> attributes) {
        PolicyAccumulator accumulator = new PolicyAccumulator();
        for (AclFieldMapping mapping : MAPPINGS) {
            accumulator.addAll(mapping.getTarget(), AttributeValues.toStringList(attributes.get(mapping.getFieldName())));
        }
        return accumulator.isEmpty() ? Optional.empty() : Optional.of(accumulator.freeze());
    }
}
