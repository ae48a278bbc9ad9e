package io.sellerlink.oauthbroker.auth.model;

public record UpsertResult(PartnerCredential credential, boolean created) {}
