package com.acme.bindle.server.reply;

import com.acme.bindle.server.util.ReplyDefaults;
import com.acme.bindle.server.util.ReplyEnvKeys;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class ReplySettingsTest {

    @Test
    void shouldUseDefaultsForMissingOrBlank() {
        assertEquals(ReplySettings.defaults(), ReplySettings.fromEnv(Map.of()));
        ReplySettings blank = ReplySettings.fromEnv(Map.of(
            ReplyEnvKeys.BINDLE_REPLY_DIAGNOSTIC_LOGGER, "  ",
            ReplyEnvKeys.BINDLE_REPLY_CLOSE_ON_SERVER_ERROR, ""
        ));
        assertEquals(ReplyDefaults.DIAGNOSTIC_LOGGER, blank.diagnosticLoggerName());
        assertEquals(ReplyDefaults.CLOSE_ON_SERVER_ERROR, blank.closeOnServerError());
    }

    @Test
    void shouldReadConfiguredValues() {
        ReplySettings settings = ReplySettings.fromEnv(Map.of(
            ReplyEnvKeys.BINDLE_REPLY_DIAGNOSTIC_LOGGER, " bindle.diagnostics ",
            ReplyEnvKeys.BINDLE_REPLY_CLOSE_ON_SERVER_ERROR, "FALSE"
        ));
        assertEquals("bindle.diagnostics", settings.diagnosticLoggerName());
        assertFalse(settings.closeOnServerError());
    }

    @Test
    void shouldFallBackOnMalformedBoolean() {
        ReplySettings settings = ReplySettings.fromEnv(Map.of(
            ReplyEnvKeys.BINDLE_REPLY_CLOSE_ON_SERVER_ERROR, "nope"
        ));
        assertEquals(ReplyDefaults.CLOSE_ON_SERVER_ERROR, settings.closeOnServerError());
    }
}
