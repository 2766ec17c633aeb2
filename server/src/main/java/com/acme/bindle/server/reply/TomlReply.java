package com.acme.bindle.server.reply;

import com.acme.bindle.server.util.BindleContentTypes;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;

import java.util.Objects;

/**
 * A value after TOML encoding: either the full body or a failure marker with nothing to send.
 */
public sealed interface TomlReply permits TomlReply.Encoded, TomlReply.Failed {

    /**
     * Builds the HTTP response. A {@link Failed} reply is always 500 with an empty body,
     * whatever status the caller asked for.
     */
    FullHttpResponse toResponse(HttpResponseStatus status);

    record Encoded(byte[] body) implements TomlReply {
        public Encoded {
            Objects.requireNonNull(body, "body");
        }

        @Override
        public FullHttpResponse toResponse(HttpResponseStatus status) {
            Objects.requireNonNull(status, "status");
            FullHttpResponse response = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1, status, Unpooled.wrappedBuffer(body));
            response.headers().set(HttpHeaderNames.CONTENT_TYPE, BindleContentTypes.TOML);
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, body.length);
            return response;
        }
    }

    record Failed() implements TomlReply {
        @Override
        public FullHttpResponse toResponse(HttpResponseStatus status) {
            FullHttpResponse response = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1, HttpResponseStatus.INTERNAL_SERVER_ERROR, Unpooled.EMPTY_BUFFER);
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, 0);
            return response;
        }
    }
}
