package io.sellerlink.oauthbroker.config;

import io.sellerlink.oauthbroker.auth.BrokerErrorKind;
import io.sellerlink.oauthbroker.auth.BrokerException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.Optional;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/** HMAC-SHA256 signature for session cookie values: {@code <id>.<base64url mac>}. */
public final class SessionIdSigner {
  private static final String ALGORITHM = "HmacSHA256";

  private final SecretKeySpec key;

  public SessionIdSigner(String secret) {
    if (secret == null || secret.isBlank()) {
      throw new BrokerException(BrokerErrorKind.CONFIG_ERROR, "session signing secret is not configured");
    }
    this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
  }

  public String sign(String sessionId) {
    return sessionId + "." + mac(sessionId);
  }

  public Optional<String> unsign(String cookieValue) {
    if (cookieValue == null) return Optional.empty();
    int idx = cookieValue.lastIndexOf('.');
    if (idx <= 0 || idx == cookieValue.length() - 1) return Optional.empty();
    String sessionId = cookieValue.substring(0, idx);
    byte[] expected = mac(sessionId).getBytes(StandardCharsets.UTF_8);
    byte[] actual = cookieValue.substring(idx + 1).getBytes(StandardCharsets.UTF_8);
    return MessageDigest.isEqual(expected, actual) ? Optional.of(sessionId) : Optional.empty();
  }

  private String mac(String value) {
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(key);
      byte[] out = mac.doFinal(value.getBytes(StandardCharsets.UTF_8));
      return Base64.getUrlEncoder().withoutPadding().encodeToString(out);
    } catch (Exception e) {
      throw new IllegalStateException("session signature error", e);
    }
  }
}
