package com.acme.bindle.server.util;

/**
 * Content types emitted by the bindle server.
 */
public final class BindleContentTypes {
    public static final String TOML = "application/toml";

    private BindleContentTypes() {
    }
}
