package com.ragguard.model;

public enum RetrievalType {

    RETRIEVE("retrieve"),
    RETRIEVE_AND_GENERATE("retrieve_and_generate");

    private final String value;

    RetrievalType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Anything other than "retrieve_and_generate" is a plain retrieval
     */
    public static RetrievalType fromValue(String value) {
        if (value != null && RETRIEVE_AND_GENERATE.value.equalsIgnoreCase(value.trim())) {
            return RETRIEVE_AND_GENERATE;
        }
        return RETRIEVE;
    }
}
