package com.ragguard.acl;

import lombok.Value;

/**
 * Declares that a raw attribute name feeds a canonical policy set
 */
@Value
public class AclFieldMapping {

    String fieldName;
    AclTarget target;

    public static AclFieldMapping of(String fieldName, AclTarget target) {
        return new AclFieldMapping(fieldName, target);
    }
}
