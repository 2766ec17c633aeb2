package com.acme.bindle.server.storage;

/**
 * Closed set of failures the storage layer reports.
 */
public enum StorageErrorKind {
    YANKED("bindle is yanked"),
    CREATE_YANKED("bindle cannot be created as yanked"),
    NOT_FOUND("resource not found"),
    IO("resource could not be loaded"),
    EXISTS("resource already exists"),
    MALFORMED("resource is malformed"),
    UNSERIALIZABLE("resource cannot be stored"),
    DIGEST_MISMATCH("digest does not match"),
    INVALID_ID("invalid ID given");

    private final String message;

    StorageErrorKind(String message) {
        this.message = message;
    }

    /** Terse, caller-safe description. Never includes cause detail. */
    public String message() {
        return message;
    }
}
