package io.sellerlink.oauthbroker.auth.model;

public record PartnerCredential(String partnerId, String refreshToken, long createdAt) {}
