package com.ragguard.acl;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.ragguard.model.AccessPolicy;
import com.ragguard.model.PermissionLevel;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Parses the structured (V2) connector ACL: a list of JSON entries such as
 * <pre>{"principal":"finance","principal_type":"group","permissions":["Read"],
 *  "access":"allow","inheritance":"direct"}</pre>
 *
 * Malformed entries are skipped and logged; the remaining entries are still applied.
 */
@Slf4j
public class StructuredAclParser implements AclParser {

    static final List<String> FIELD_NAMES = List.of("acl_v2", "sharepoint_acl_v2");

    private final Gson gson = new Gson();

    @Override
    public AclEncoding encoding() {
        return AclEncoding.STRUCTURED_V2;
    }

    @Override
    public Optional<AccessPolicy> parse(Map<String, Object> attributes) {
        PolicyAccumulator accumulator = new PolicyAccumulator();

        for (String field : FIELD_NAMES) {
            Object value = attributes.get(field);
            if (value == null) {
                continue;
            }
            for (Object entry : entries(field, value)) {
                applyEntry(accumulator, entry);
            }
        }

        return accumulator.isEmpty() ? Optional.empty() : Optional.of(accumulator.freeze());
    }

    private List<Object> entries(String field, Object value) {
        List<Object> entries = new ArrayList<>();
        if (value instanceof Collection) {
            entries.addAll((Collection<?>) value);
            return entries;
        }
        String text = value.toString().trim();
        if (text.startsWith("[")) {
            try {
                JsonArray array = JsonParser.parseString(text).getAsJsonArray();
                for (JsonElement element : array) {
                    entries.add(element);
                }
            } catch (RuntimeException e) {
                log.warn("Unparseable ACL list in field {}: {}", field, e.getMessage());
            }
            return entries;
        }
        entries.add(value);
        return entries;
    }

    private void applyEntry(PolicyAccumulator accumulator, Object rawEntry) {
        try {
            JsonObject entry = toJsonObject(rawEntry);

            String principal = stringMember(entry, "principal");
            if (principal == null || principal.isBlank()) {
                log.warn("Skipping ACL entry without principal: {}", rawEntry);
                return;
            }
            principal = principal.trim();

            String typeValue = stringMember(entry, "principal_type");
            if (typeValue == null) {
                typeValue = stringMember(entry, "type");
            }
            PermissionLevel.PrincipalType principalType = parsePrincipalType(typeValue);
            PermissionLevel.Access access = parseAccess(stringMember(entry, "access"));
            if (principalType == null || access == null) {
                log.warn("Skipping ACL entry with unknown principal type or access: {}", rawEntry);
                return;
            }

            PermissionLevel level = PermissionLevel.builder()
                    .permissions(permissions(entry.get("permissions")))
                    .inheritance(parseInheritance(stringMember(entry, "inheritance")))
                    .principalType(principalType)
                    .access(access)
                    .build();

            boolean group = principalType != PermissionLevel.PrincipalType.USER;
            if (access == PermissionLevel.Access.ALLOW) {
                accumulator.add(group ? AclTarget.ALLOWED_GROUPS : AclTarget.ALLOWED_USERS, principal);
            } else {
                accumulator.add(group ? AclTarget.DENIED_GROUPS : AclTarget.DENIED_USERS, principal);
            }
            accumulator.recordLevel(principal, level);

        } catch (RuntimeException e) {
            log.warn("Failed to parse V2 ACL entry: {}, error: {}", rawEntry, e.getMessage());
        }
    }

    private JsonObject toJsonObject(Object rawEntry) {
        if (rawEntry instanceof JsonElement) {
            return ((JsonElement) rawEntry).getAsJsonObject();
        }
        if (rawEntry instanceof Map) {
            return gson.toJsonTree(rawEntry).getAsJsonObject();
        }
        return JsonParser.parseString(String.valueOf(rawEntry)).getAsJsonObject();
    }

    private String stringMember(JsonObject entry, String name) {
        JsonElement element = entry.get(name);
        if (element == null || element.isJsonNull()) {
            return null;
        }
        return element.getAsString();
    }

    private List<String> permissions(JsonElement element) {
        List<String> permissions = new ArrayList<>();
        if (element == null || element.isJsonNull()) {
            return permissions;
        }
        if (element.isJsonArray()) {
            for (JsonElement permission : element.getAsJsonArray()) {
                permissions.add(permission.getAsString());
            }
        } else {
            permissions.add(element.getAsString());
        }
        return permissions;
    }

    private PermissionLevel.PrincipalType parsePrincipalType(String value) {
        if (value == null || value.isBlank()) {
            return PermissionLevel.PrincipalType.USER;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "user" -> PermissionLevel.PrincipalType.USER;
            case "group" -> PermissionLevel.PrincipalType.GROUP;
            case "role" -> PermissionLevel.PrincipalType.ROLE;
            default -> null;
        };
    }

    private PermissionLevel.Access parseAccess(String value) {
        if (value == null || value.isBlank()) {
            return PermissionLevel.Access.ALLOW;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "allow" -> PermissionLevel.Access.ALLOW;
            case "deny" -> PermissionLevel.Access.DENY;
            default -> null;
        };
    }

    private PermissionLevel.Inheritance parseInheritance(String value) {
        if (value != null && "direct".equalsIgnoreCase(value.trim())) {
            return PermissionLevel.Inheritance.DIRECT;
        }
        return PermissionLevel.Inheritance.INHERITED;
    }
}
