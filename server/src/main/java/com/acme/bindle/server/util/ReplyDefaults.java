package com.acme.bindle.server.util;

/**
 * Defaults used when the corresponding environment variable is not set.
 */
public final class ReplyDefaults {

    // ---- Diagnostics ----
    public static final String DIAGNOSTIC_LOGGER = "com.acme.bindle.server.reply.Replies";

    // ---- Connection handling ----
    public static final boolean CLOSE_ON_SERVER_ERROR = true;

    private ReplyDefaults() {
    }
}
