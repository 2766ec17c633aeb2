package com.acme.bindle.server.reply;

import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelOutboundInvoker;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.HttpUtil;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Flushes built replies to a Netty channel, keeping the connection only when the request
 * asked for keep-alive.
 */
public final class ReplyWriter {
    private static final Logger LOG = Logger.getLogger(ReplyWriter.class.getName());

    private final boolean closeOnServerError;

    public ReplyWriter(ReplySettings settings) {
        this.closeOnServerError = Objects.requireNonNull(settings, "settings").closeOnServerError();
    }

    public ChannelFuture write(ChannelOutboundInvoker out, HttpRequest req, FullHttpResponse response) {
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(req, "req");
        Objects.requireNonNull(response, "response");

        boolean serverError = response.status().code() >= 500;
        boolean keepAlive = HttpUtil.isKeepAlive(req) && !(serverError && closeOnServerError);
        if (keepAlive) {
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
            return out.writeAndFlush(response);
        }
        if (serverError) {
            LOG.fine(() -> "Closing connection after " + response.status() + " for " + req.uri());
        }
        response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        return out.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }
}
