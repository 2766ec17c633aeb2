package com.acme.bindle.server.util;

/**
 * Canonical environment variable names read by the reply layer.
 */
public final class ReplyEnvKeys {
    public static final String BINDLE_REPLY_DIAGNOSTIC_LOGGER = "BINDLE_REPLY_DIAGNOSTIC_LOGGER";
    public static final String BINDLE_REPLY_CLOSE_ON_SERVER_ERROR = "BINDLE_REPLY_CLOSE_ON_SERVER_ERROR";

    private ReplyEnvKeys() {
    }
}
