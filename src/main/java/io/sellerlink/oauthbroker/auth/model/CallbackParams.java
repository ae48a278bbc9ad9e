package io.sellerlink.oauthbroker.auth.model;

public record CallbackParams(String code, String state, String partnerId) {}
