package io.sellerlink.oauthbroker.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.sellerlink.oauthbroker.auth.BrokerException;
import io.sellerlink.oauthbroker.auth.model.PartnerCredential;
import io.sellerlink.oauthbroker.auth.model.UpsertResult;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

class RedisCredentialStoreTest {
  private StringRedisTemplate redis;
  private HashOperations<String, Object, Object> hashOps;
  private RedisCredentialStore store;

  @BeforeEach
  @SuppressWarnings("unchecked")
  void setUp() {
    redis = mock(StringRedisTemplate.class);
    hashOps = mock(HashOperations.class);
    when(redis.<Object, Object>opsForHash()).thenReturn(hashOps);
    store = new RedisCredentialStore(redis);
  }

  @Test
  void upsertScriptWritesTokenAlwaysAndCreatedAtOnlyOnce() {
    String script = RedisCredentialStore.UPSERT_SCRIPT.getScriptAsString();

    assertThat(script)
        .contains("redis.call('HSET', KEYS[1], 'partnerId', ARGV[1], 'refreshToken', ARGV[2])")
        .contains("redis.call('HSETNX', KEYS[1], 'createdAt', ARGV[3])")
        .contains("redis.call('HGET', KEYS[1], 'createdAt')")
        .doesNotContain("EXPIRE");
    assertThat(script.indexOf("'HSET'")).isLessThan(script.indexOf("'HSETNX'"));
    assertThat(RedisCredentialStore.UPSERT_SCRIPT.getResultType()).isEqualTo(String.class);
  }

  @Test
  void upsertRunsAtomicScriptAgainstPartnerKey() {
    when(redis.execute(
            RedisCredentialStore.UPSERT_SCRIPT,
            List.of("oauth:credential:A1B2C3"),
            "A1B2C3",
            "Atzr|token",
            "1700000000000"))
        .thenReturn("1:1700000000000");

    UpsertResult result = store.upsert("A1B2C3", "Atzr|token", 1_700_000_000_000L);

    assertThat(result.created()).isTrue();
    assertThat(result.credential())
        .isEqualTo(new PartnerCredential("A1B2C3", "Atzr|token", 1_700_000_000_000L));
  }

  @Test
  void upsertOfExistingPartnerKeepsStoredCreatedAt() {
    when(redis.execute(
            RedisCredentialStore.UPSERT_SCRIPT,
            List.of("oauth:credential:A1B2C3"),
            "A1B2C3",
            "Atzr|new",
            "1700000000000"))
        .thenReturn("0:1600000000000");

    UpsertResult result = store.upsert("A1B2C3", "Atzr|new", 1_700_000_000_000L);

    assertThat(result.created()).isFalse();
    assertThat(result.credential().createdAt()).isEqualTo(1_600_000_000_000L);
    assertThat(result.credential().refreshToken()).isEqualTo("Atzr|new");
  }

  @Test
  void emptyScriptResultIsInternalError() {
    // unstubbed script call answers null
    assertThatThrownBy(() -> store.upsert("A1B2C3", "Atzr|token", 1L))
        .isInstanceOf(BrokerException.class);
  }

  @Test
  void findMapsHashFields() {
    when(hashOps.entries("oauth:credential:A1B2C3"))
        .thenReturn(
            Map.of("partnerId", "A1B2C3", "refreshToken", "Atzr|token", "createdAt", "1600000000000"));

    assertThat(store.find("A1B2C3"))
        .contains(new PartnerCredential("A1B2C3", "Atzr|token", 1_600_000_000_000L));
  }

  @Test
  void findOfUnknownPartnerIsEmpty() {
    when(hashOps.entries("oauth:credential:missing")).thenReturn(Map.of());

    assertThat(store.find("missing")).isEmpty();
    assertThat(store.find(" ")).isEmpty();
  }
}
