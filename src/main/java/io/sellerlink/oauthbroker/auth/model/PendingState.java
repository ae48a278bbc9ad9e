package io.sellerlink.oauthbroker.auth.model;

import java.io.Serializable;

/** Nonce bound to a caller session by {@code /start-oauth}. An {@code expiresAt} of 0 never expires. */
public record PendingState(String state, long issuedAt, long expiresAt) implements Serializable {
  public boolean isExpired(long now) {
    return expiresAt > 0 && expiresAt < now;
  }
}
