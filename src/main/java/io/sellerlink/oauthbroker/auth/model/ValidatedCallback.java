package io.sellerlink.oauthbroker.auth.model;

public record ValidatedCallback(String code, String state, String partnerId) {}
