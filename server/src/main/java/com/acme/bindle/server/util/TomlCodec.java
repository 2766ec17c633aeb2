package com.acme.bindle.server.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;

import java.io.IOException;

/**
 * Shared TOML codec for reply bodies.
 *
 * <p>Reading is strict: properties the target type does not declare are rejected.</p>
 *
 * <p>The TOML reader in jackson-dataformat-toml 2.17 truncates 19-digit integers; integers up to
 * 10^15 read back intact. Writing is exact across the whole {@code long} range.</p>
 */
public final class TomlCodec {
    private static final TomlMapper MAPPER = TomlMapper.builder()
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();

    private TomlCodec() {
    }

    public static byte[] writeBytes(Object value) throws JsonProcessingException {
        return MAPPER.writeValueAsBytes(value);
    }

    public static <T> T read(byte[] raw, Class<T> type) throws IOException {
        return MAPPER.readValue(raw, type);
    }

    public static JsonNode readTree(byte[] raw) throws IOException {
        return MAPPER.readTree(raw);
    }
}
