package com.acme.bindle.server.reply;

import com.acme.bindle.server.storage.StorageException;
import com.acme.bindle.server.util.TomlCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds TOML replies for request handlers.
 *
 * <p>Encoding failures never reach the caller: they are logged once on the diagnostic
 * logger and turned into an empty 500 response. Instances are immutable and safe to share
 * across event loops.</p>
 */
public final class Replies {
    private final Logger diagnostics;

    public Replies(ReplySettings settings) {
        this(Logger.getLogger(Objects.requireNonNull(settings, "settings").diagnosticLoggerName()));
    }

    public Replies(Logger diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /** Encodes {@code value}; the result carries either the whole body or nothing. */
    public TomlReply toml(Object value) {
        try {
            return new TomlReply.Encoded(TomlCodec.writeBytes(value));
        } catch (JsonProcessingException | RuntimeException e) {
            diagnostics.log(Level.SEVERE, "Error while serializing TOML", e);
            return new TomlReply.Failed();
        }
    }

    /** Success reply for {@code value} with a status already decided by the handler. */
    public FullHttpResponse withStatus(Object value, HttpResponseStatus status) {
        Objects.requireNonNull(status, "status");
        return toml(value).toResponse(status);
    }

    /**
     * Error reply {@code error = "<text>"} with the given status. Throwables render as their
     * message, anything else through {@link String#valueOf(Object)}.
     */
    public FullHttpResponse fromError(Object error, HttpResponseStatus status) {
        Objects.requireNonNull(status, "status");
        return withStatus(new ErrorBody(errorText(error)), status);
    }

    /** Classifies {@code error} and renders the (possibly remapped) error. */
    public FullHttpResponse fromStorageError(StorageException error) {
        StorageErrorClassifier.Classification classification = StorageErrorClassifier.classify(error);
        return fromError(classification.error(), classification.status());
    }

    private static String errorText(Object error) {
        if (error instanceof Throwable t) {
            String message = t.getMessage();
            return message == null ? t.getClass().getSimpleName() : message;
        }
        return String.valueOf(error);
    }
}
