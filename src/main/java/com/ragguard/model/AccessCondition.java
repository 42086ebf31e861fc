package com.ragguard.model;

import lombok.Value;

/**
 * Equality condition over one access-control metadata field
 */
@Value
public class AccessCondition {

    public enum Field {
        ACCESS_USERS("access_users"),
        CREATED_BY("created_by"),
        ACCESS_GROUPS("access_groups"),
        CLASSIFICATION("classification");

        private final String key;

        Field(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }
    }

    Field field;
    String value;

    public static AccessCondition of(Field field, String value) {
        return new AccessCondition(field, value);
    }
}
