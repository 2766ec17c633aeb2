package com.acme.bindle.server.model;

public record Parcel(Label label) { }
