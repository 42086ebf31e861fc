package com.ragguard.acl;

import com.ragguard.model.AccessPolicy;
import lombok.Value;

/**
 * A policy together with the encoding it was read from
 */
@Value
public class NormalizedAcl {

    AclEncoding encoding;
    AccessPolicy policy;
}
