package com.ragguard.acl;

import com.ragguard.model.AccessPolicy;

import java.util.Map;
import java.util.Optional;

/**
 * Parser for one access-control encoding. Implementations are pure: no I/O, no shared state.
 */
public interface AclParser {

    AclEncoding encoding();

    /**
     * Parses the encoding from raw attributes.
     *
     * @return the policy, or empty when the attributes carry no data in this encoding
     */
    Optional<AccessPolicy> parse(Map<String, Object> attributes);
}
