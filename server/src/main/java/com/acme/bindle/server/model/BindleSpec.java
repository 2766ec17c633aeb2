package com.acme.bindle.server.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record BindleSpec(
    String name,
    String version,
    String description,
    List<String> authors
) {
    public BindleSpec {
        authors = authors == null ? List.of() : List.copyOf(authors);
    }

    public BindleSpec(String name, String version) {
        this(name, version, null, List.of());
    }
}
