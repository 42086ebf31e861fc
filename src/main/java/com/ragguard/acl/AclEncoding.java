package com.ragguard.acl;

/**
 * Access-control encodings understood by the normalizer, in detection priority order
 */
public enum AclEncoding {

    /** List of JSON ACL entries with principal type, permissions, access and inheritance */
    STRUCTURED_V2,

    /** Parallel flat lists of allowed/denied users and groups */
    LEGACY,

    /** Loose "principals" style fields, single value or list */
    ALTERNATE_FIELDS
}
