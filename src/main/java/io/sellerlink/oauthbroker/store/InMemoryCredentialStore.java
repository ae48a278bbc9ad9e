package io.sellerlink.oauthbroker.store;

import io.sellerlink.oauthbroker.auth.model.PartnerCredential;
import io.sellerlink.oauthbroker.auth.model.UpsertResult;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Process-local store for local runs; contents are lost on restart. */
@Component
@ConditionalOnProperty(name = "app.store.type", havingValue = "memory")
public class InMemoryCredentialStore implements CredentialStore {
  private final ConcurrentMap<String, PartnerCredential> records = new ConcurrentHashMap<>();

  @Override
  public UpsertResult upsert(String partnerId, String refreshToken, long now) {
    AtomicBoolean created = new AtomicBoolean(false);
    PartnerCredential stored =
        records.compute(
            partnerId,
            (key, existing) -> {
              if (existing == null) {
                created.set(true);
                return new PartnerCredential(key, refreshToken, now);
              }
              return new PartnerCredential(key, refreshToken, existing.createdAt());
            });
    return new UpsertResult(stored, created.get());
  }

  @Override
  public Optional<PartnerCredential> find(String partnerId) {
    if (partnerId == null) return Optional.empty();
    return Optional.ofNullable(records.get(partnerId));
  }
}
