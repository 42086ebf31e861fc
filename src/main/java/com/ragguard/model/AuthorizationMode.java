package com.ragguard.model;

/**
 * How a backend was asked to enforce authorization
 */
public enum AuthorizationMode {

    /** The access predicate was pushed to the backend as a filter */
    PREDICATE,

    /** An opaque caller token was passed and the backend enforces access itself */
    TOKEN
}
