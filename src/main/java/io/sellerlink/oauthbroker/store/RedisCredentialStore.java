package io.sellerlink.oauthbroker.store;

import io.sellerlink.oauthbroker.auth.BrokerErrorKind;
import io.sellerlink.oauthbroker.auth.BrokerException;
import io.sellerlink.oauthbroker.auth.model.PartnerCredential;
import io.sellerlink.oauthbroker.auth.model.UpsertResult;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

/**
 * One Redis hash per partner under {@code oauth:credential:<partnerId>}, without TTL. The upsert
 * runs as a single Lua script, which Redis executes atomically.
 */
@Component
@ConditionalOnProperty(name = "app.store.type", havingValue = "redis", matchIfMissing = true)
public class RedisCredentialStore implements CredentialStore {
  static final String PREFIX_CREDENTIAL = "oauth:credential:";

  // Returns "<1 if created else 0>:<createdAt>".
  static final RedisScript<String> UPSERT_SCRIPT =
      new DefaultRedisScript<>(
          "redis.call('HSET', KEYS[1], 'partnerId', ARGV[1], 'refreshToken', ARGV[2])\n"
              + "local created = redis.call('HSETNX', KEYS[1], 'createdAt', ARGV[3])\n"
              + "return tostring(created) .. ':' .. redis.call('HGET', KEYS[1], 'createdAt')",
          String.class);

  private final StringRedisTemplate redis;

  public RedisCredentialStore(StringRedisTemplate redis) {
    this.redis = redis;
  }

  @Override
  public UpsertResult upsert(String partnerId, String refreshToken, long now) {
    String raw =
        redis.execute(
            UPSERT_SCRIPT,
            List.of(PREFIX_CREDENTIAL + partnerId),
            partnerId,
            refreshToken,
            String.valueOf(now));
    if (raw == null || raw.indexOf(':') < 0) {
      throw new BrokerException(BrokerErrorKind.INTERNAL_ERROR, "credential upsert returned no result");
    }
    int idx = raw.indexOf(':');
    boolean created = "1".equals(raw.substring(0, idx));
    long createdAt = parseLong(raw.substring(idx + 1));
    return new UpsertResult(new PartnerCredential(partnerId, refreshToken, createdAt), created);
  }

  @Override
  public Optional<PartnerCredential> find(String partnerId) {
    if (partnerId == null || partnerId.isBlank()) return Optional.empty();
    Map<Object, Object> entries = redis.opsForHash().entries(PREFIX_CREDENTIAL + partnerId);
    if (entries == null || entries.isEmpty()) return Optional.empty();
    Object refreshToken = entries.get("refreshToken");
    Object createdAt = entries.get("createdAt");
    return Optional.of(
        new PartnerCredential(
            partnerId,
            refreshToken == null ? "" : refreshToken.toString(),
            createdAt == null ? 0 : parseLong(createdAt.toString())));
  }

  private static long parseLong(String value) {
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new BrokerException(
          BrokerErrorKind.INTERNAL_ERROR, "stored createdAt is not a number: " + value, e);
    }
  }
}
