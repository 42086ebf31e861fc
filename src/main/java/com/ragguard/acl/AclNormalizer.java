package com.ragguard.acl;

import com.ragguard.model.AccessPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Converts source-specific, versioned access-control attributes into one canonical {@link AccessPolicy}.
 *
 * <p>Parsers are tried in a fixed priority order (structured V2, legacy lists, alternate
 * principal fields) and the first one that yields data wins. Normalization never throws:
 * malformed input produces an empty policy, which leaves the document reachable only
 * through the public-classification fallback.
 */
@Slf4j
@Service
public class AclNormalizer {

    private final List<AclParser> parsers;

    public AclNormalizer() {
        this(List.of(new StructuredAclParser(), new LegacyAclParser(), new AlternateFieldAclParser()));
    }

    AclNormalizer(List<AclParser> parsers) {
        this.parsers = List.copyOf(parsers);
    }

    public AccessPolicy normalize(Map<String, Object> rawAttributes) {
        return detect(rawAttributes)
                .map(NormalizedAcl::getPolicy)
                .orElse(AccessPolicy.empty());
    }

    /**
     * Normalizes and reports which encoding supplied the policy
     */
    public Optional<NormalizedAcl> detect(Map<String, Object> rawAttributes) {
        if (rawAttributes == null || rawAttributes.isEmpty()) {
            return Optional.empty();
        }
        for (AclParser parser : parsers) {
            try {
                Optional<AccessPolicy> policy = parser.parse(rawAttributes);
                if (policy.isPresent() && !policy.get().isEmpty()) {
                    return Optional.of(new NormalizedAcl(parser.encoding(), policy.get()));
                }
            } catch (RuntimeException e) {
                log.warn("Malformed ACL attributes for encoding {}: {}", parser.encoding(), e.getMessage());
                return Optional.empty();
            }
        }
        log.debug("No ACL data found in attributes {}", rawAttributes.keySet());
        return Optional.empty();
    }
}
