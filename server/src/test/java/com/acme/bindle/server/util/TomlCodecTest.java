package com.acme.bindle.server.util;

import com.acme.bindle.server.model.Label;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TomlCodecTest {

    @Test
    void shouldRoundTripLargeParcelSize() throws Exception {
        Label label = new Label("cccc", "application/octet-stream", "disk.img", 999_999_999_999_999L);

        byte[] body = TomlCodec.writeBytes(label);

        assertEquals(label, TomlCodec.read(body, Label.class));
    }

    @Test
    void shouldWriteFullLongRangeExactly() throws Exception {
        byte[] body = TomlCodec.writeBytes(new Label("dddd", "application/octet-stream", "huge.img", Long.MAX_VALUE));

        String text = new String(body, StandardCharsets.UTF_8);
        assertTrue(text.contains("9223372036854775807"), text);
    }
}
