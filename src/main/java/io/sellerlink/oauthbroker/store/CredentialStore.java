package io.sellerlink.oauthbroker.store;

import io.sellerlink.oauthbroker.auth.model.PartnerCredential;
import io.sellerlink.oauthbroker.auth.model.UpsertResult;
import java.util.Optional;

/**
 * Durable credential records keyed by selling partner id.
 *
 * <p>{@link #upsert} must be atomic per partner id: concurrent callers never produce two records,
 * and {@code createdAt} is written only by the call that creates the record.
 */
public interface CredentialStore {
  UpsertResult upsert(String partnerId, String refreshToken, long now);

  Optional<PartnerCredential> find(String partnerId);
}
