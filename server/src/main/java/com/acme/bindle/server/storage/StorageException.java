package com.acme.bindle.server.storage;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.Objects;

/**
 * Failure raised by the storage layer. The message is always the kind's fixed text;
 * underlying I/O or codec failures travel as the cause.
 */
public final class StorageException extends Exception {
    private final StorageErrorKind kind;

    private StorageException(StorageErrorKind kind, Throwable cause) {
        super(kind.message(), cause);
        this.kind = kind;
    }

    public static StorageException yanked() {
        return new StorageException(StorageErrorKind.YANKED, null);
    }

    public static StorageException createYanked() {
        return new StorageException(StorageErrorKind.CREATE_YANKED, null);
    }

    public static StorageException notFound() {
        return new StorageException(StorageErrorKind.NOT_FOUND, null);
    }

    public static StorageException io(IOException cause) {
        return new StorageException(StorageErrorKind.IO, Objects.requireNonNull(cause, "cause"));
    }

    public static StorageException exists() {
        return new StorageException(StorageErrorKind.EXISTS, null);
    }

    public static StorageException malformed(Throwable cause) {
        return new StorageException(StorageErrorKind.MALFORMED, cause);
    }

    public static StorageException unserializable(Throwable cause) {
        return new StorageException(StorageErrorKind.UNSERIALIZABLE, cause);
    }

    public static StorageException digestMismatch() {
        return new StorageException(StorageErrorKind.DIGEST_MISMATCH, null);
    }

    public static StorageException invalidId() {
        return new StorageException(StorageErrorKind.INVALID_ID, null);
    }

    public StorageErrorKind kind() {
        return kind;
    }

    /**
     * True when this is an {@link StorageErrorKind#IO} failure caused by a missing file,
     * i.e. the same condition as {@link StorageErrorKind#NOT_FOUND} reached through the filesystem.
     */
    public boolean isResourceAbsent() {
        if (kind != StorageErrorKind.IO) {
            return false;
        }
        Throwable cause = getCause();
        return cause instanceof NoSuchFileException || cause instanceof FileNotFoundException;
    }
}
