package com.ragguard.service;

import com.ragguard.model.AccessPolicy;
import com.ragguard.model.Classification;
import com.ragguard.model.ClassificationResult;
import com.ragguard.model.PermissionLevel;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Infers a classification and department for documents that carry no explicit tag.
 *
 * <p>This is a heuristic with known false positives (short keywords such as "it" match
 * many group names). It labels documents; it never grants or removes access. Access is
 * decided only by the allow/deny sets of the {@link AccessPolicy}.
 */
@Slf4j
@Service
public class ClassificationService {

    public static final String DEFAULT_DEPARTMENT = "general";

    static final Set<String> FULL_CONTROL_PERMISSIONS = Set.of("full control", "full_control", "fullcontrol", "owner");

    static final Set<String> PUBLIC_GROUPS = Set.of(
            "everyone", "all users", "company users", "all employees", "everyone except external users");

    // Insertion order is the match order
    private static final Map<String, List<String>> DEPARTMENT_KEYWORDS = new LinkedHashMap<>();

    static {
        DEPARTMENT_KEYWORDS.put("finance", List.of("finance", "accounting", "treasury", "budget"));
        DEPARTMENT_KEYWORDS.put("hr", List.of("hr", "human resources", "people", "talent"));
        DEPARTMENT_KEYWORDS.put("legal", List.of("legal", "compliance", "risk", "audit"));
        DEPARTMENT_KEYWORDS.put("engineering", List.of("engineering", "development", "tech", "it"));
        DEPARTMENT_KEYWORDS.put("sales", List.of("sales", "business development", "revenue"));
        DEPARTMENT_KEYWORDS.put("marketing", List.of("marketing", "communications", "brand"));
        DEPARTMENT_KEYWORDS.put("operations", List.of("operations", "ops", "facilities"));
    }

    /**
     * ACL-shape rules, evaluated top to bottom
     */
    private static final List<ShapeRule> ACL_RULES = List.of(
            new ShapeRule("few owners, few users",
                    s -> s.getFullControlCount() >= 1 && s.getFullControlCount() <= 2 && s.getAllowedUserCount() <= 3,
                    Classification.RESTRICTED),
            new ShapeRule("limited owners, no public group",
                    s -> s.getFullControlCount() >= 1 && s.getFullControlCount() <= 5 && !s.isPublicGroupPresent(),
                    Classification.CONFIDENTIAL),
            new ShapeRule("company-wide group",
                    ShapeFacts::isPublicGroupPresent,
                    Classification.INTERNAL),
            new ShapeRule("few groups",
                    s -> s.getAllowedGroupCount() <= 3,
                    Classification.CONFIDENTIAL),
            new ShapeRule("broad access",
                    s -> true,
                    Classification.INTERNAL)
    );

    public ClassificationResult classify(AccessPolicy policy, String pathHint, String filenameHint) {
        Optional<ClassificationResult> fromPath = classifyFromPath(pathHint);
        if (fromPath.isPresent()) {
            return fromPath.get();
        }

        if (policy != null && hasAclSignal(policy)) {
            return classifyFromAcl(policy);
        }

        String fileDepartment = departmentFor(filenameHint == null ? List.of() : List.of(filenameHint));
        if (!DEFAULT_DEPARTMENT.equals(fileDepartment)) {
            return ClassificationResult.builder()
                    .classification(Classification.INTERNAL)
                    .department(fileDepartment)
                    .basis(ClassificationResult.Basis.FILENAME)
                    .build();
        }

        return ClassificationResult.builder()
                .classification(Classification.INTERNAL)
                .department(DEFAULT_DEPARTMENT)
                .basis(ClassificationResult.Basis.DEFAULT)
                .build();
    }

    /**
     * Department from group names: case-insensitive substring match, first department wins
     */
    public String departmentFor(Collection<String> names) {
        for (String name : names) {
            if (name == null) {
                continue;
            }
            String lower = name.toLowerCase(Locale.ROOT);
            for (Map.Entry<String, List<String>> entry : DEPARTMENT_KEYWORDS.entrySet()) {
                for (String keyword : entry.getValue()) {
                    if (lower.contains(keyword)) {
                        return entry.getKey();
                    }
                }
            }
        }
        return DEFAULT_DEPARTMENT;
    }

    /**
     * A path of the form department/classification/creator/... decides outright
     */
    private Optional<ClassificationResult> classifyFromPath(String pathHint) {
        if (pathHint == null || pathHint.isBlank()) {
            return Optional.empty();
        }
        List<String> segments = Arrays.stream(pathHint.split("/"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
        if (segments.size() < 3) {
            return Optional.empty();
        }
        Optional<Classification> classification = Classification.fromValue(segments.get(1));
        if (classification.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(ClassificationResult.builder()
                .classification(classification.get())
                .department(segments.get(0).toLowerCase(Locale.ROOT))
                .createdBy(segments.get(2))
                .basis(ClassificationResult.Basis.PATH)
                .build());
    }

    private boolean hasAclSignal(AccessPolicy policy) {
        return policy.hasAllowData() || !policy.getPermissionLevels().isEmpty();
    }

    private ClassificationResult classifyFromAcl(AccessPolicy policy) {
        ShapeFacts facts = ShapeFacts.of(policy);
        for (ShapeRule rule : ACL_RULES) {
            if (rule.getCondition().test(facts)) {
                log.debug("ACL rule '{}' matched: {}", rule.getName(), facts);
                return ClassificationResult.builder()
                        .classification(rule.getResult())
                        .department(departmentFor(policy.getAllowedGroups()))
                        .basis(ClassificationResult.Basis.ACL)
                        .build();
            }
        }
        throw new IllegalStateException("ACL rule table has no catch-all rule");
    }

    @Value
    static class ShapeRule {
        String name;
        Predicate<ShapeFacts> condition;
        Classification result;
    }

    @Value
    static class ShapeFacts {
        int fullControlCount;
        int allowedUserCount;
        int allowedGroupCount;
        boolean publicGroupPresent;

        static ShapeFacts of(AccessPolicy policy) {
            int fullControl = 0;
            for (Map.Entry<String, PermissionLevel> entry : policy.getPermissionLevels().entrySet()) {
                PermissionLevel level = entry.getValue();
                if (level.getAccess() == PermissionLevel.Access.ALLOW
                        && level.hasAnyPermission(FULL_CONTROL_PERMISSIONS)) {
                    fullControl++;
                }
            }
            boolean publicGroup = policy.getAllowedGroups().stream()
                    .anyMatch(g -> PUBLIC_GROUPS.contains(g.toLowerCase(Locale.ROOT)));
            return new ShapeFacts(fullControl, policy.getAllowedUsers().size(),
                    policy.getAllowedGroups().size(), publicGroup);
        }
    }
}
