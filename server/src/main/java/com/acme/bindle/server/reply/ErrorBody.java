package com.acme.bindle.server.reply;

/**
 * Body of every error reply: {@code error = "<message>"}.
 */
public record ErrorBody(String error) { }
