package com.acme.bindle.server.reply;

import com.acme.bindle.server.util.EnvVars;
import com.acme.bindle.server.util.ReplyDefaults;
import com.acme.bindle.server.util.ReplyEnvKeys;

import java.util.Map;
import java.util.Objects;

/**
 * Reply-layer settings resolved from the environment. Missing, blank, or malformed values
 * fall back to {@link ReplyDefaults}.
 */
public record ReplySettings(String diagnosticLoggerName, boolean closeOnServerError) {

    public ReplySettings {
        Objects.requireNonNull(diagnosticLoggerName, "diagnosticLoggerName");
    }

    public static ReplySettings defaults() {
        return new ReplySettings(ReplyDefaults.DIAGNOSTIC_LOGGER, ReplyDefaults.CLOSE_ON_SERVER_ERROR);
    }

    public static ReplySettings fromEnv() {
        return fromEnv(System.getenv());
    }

    public static ReplySettings fromEnv(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return new ReplySettings(
            EnvVars.getOrDefault(env, ReplyEnvKeys.BINDLE_REPLY_DIAGNOSTIC_LOGGER, ReplyDefaults.DIAGNOSTIC_LOGGER),
            EnvVars.getBoolean(env, ReplyEnvKeys.BINDLE_REPLY_CLOSE_ON_SERVER_ERROR, ReplyDefaults.CLOSE_ON_SERVER_ERROR)
        );
    }
}
