package com.acme.bindle.server.storage;

import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StorageExceptionTest {

    @Test
    void shouldUseKindMessageAndKeepCauseOutOfIt() {
        IOException cause = new IOException("/var/lib/bindle/invoices/abc: permission denied");
        StorageException e = StorageException.io(cause);

        assertEquals(StorageErrorKind.IO, e.kind());
        assertEquals("resource could not be loaded", e.getMessage());
        assertSame(cause, e.getCause());
        assertEquals("bindle is yanked", StorageException.yanked().getMessage());
        assertEquals("invalid ID given", StorageException.invalidId().getMessage());
    }

    @Test
    void shouldDetectResourceAbsentOnlyForMissingFiles() {
        assertTrue(StorageException.io(new NoSuchFileException("a")).isResourceAbsent());
        assertTrue(StorageException.io(new FileNotFoundException("b")).isResourceAbsent());
        assertFalse(StorageException.io(new AccessDeniedException("c")).isResourceAbsent());
        assertFalse(StorageException.io(new IOException("d")).isResourceAbsent());
        assertFalse(StorageException.notFound().isResourceAbsent());
        assertFalse(StorageException.malformed(new FileNotFoundException("e")).isResourceAbsent());
    }

    @Test
    void shouldRequireCauseForIo() {
        assertThrows(NullPointerException.class, () -> StorageException.io(null));
    }
}
