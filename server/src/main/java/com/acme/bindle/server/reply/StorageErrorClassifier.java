package com.acme.bindle.server.reply;

import com.acme.bindle.server.storage.StorageException;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.util.Objects;

/**
 * Maps storage failures to HTTP statuses.
 *
 * <p>Client-caused and state-conflict failures are 4xx; only unexpected I/O is 5xx.
 * An I/O failure for a missing file is reported as {@code NOT_FOUND}, and the remapped
 * error is what callers must render.</p>
 */
public final class StorageErrorClassifier {

    public record Classification(StorageException error, HttpResponseStatus status) {
        public Classification {
            Objects.requireNonNull(error, "error");
            Objects.requireNonNull(status, "status");
        }
    }

    private StorageErrorClassifier() {
    }

    public static Classification classify(StorageException error) {
        Objects.requireNonNull(error, "error");
        return switch (error.kind()) {
            case YANKED -> new Classification(error, HttpResponseStatus.BAD_REQUEST);
            case CREATE_YANKED -> new Classification(error, HttpResponseStatus.UNPROCESSABLE_ENTITY);
            case NOT_FOUND -> new Classification(error, HttpResponseStatus.NOT_FOUND);
            case IO -> error.isResourceAbsent()
                ? new Classification(StorageException.notFound(), HttpResponseStatus.NOT_FOUND)
                : new Classification(error, HttpResponseStatus.INTERNAL_SERVER_ERROR);
            case EXISTS -> new Classification(error, HttpResponseStatus.BAD_REQUEST);
            case MALFORMED -> new Classification(error, HttpResponseStatus.BAD_REQUEST);
            case UNSERIALIZABLE -> new Classification(error, HttpResponseStatus.BAD_REQUEST);
            case DIGEST_MISMATCH -> new Classification(error, HttpResponseStatus.BAD_REQUEST);
            case INVALID_ID -> new Classification(error, HttpResponseStatus.BAD_REQUEST);
        };
    }
}
