package com.acme.bindle.server.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Identifying metadata for a parcel.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Label(
    String sha256,
    String mediaType,
    String name,
    long size,
    Map<String, String> annotations
) {
    public Label {
        annotations = annotations == null ? Map.of() : Map.copyOf(annotations);
    }

    public Label(String sha256, String mediaType, String name, long size) {
        this(sha256, mediaType, name, size, Map.of());
    }
}
