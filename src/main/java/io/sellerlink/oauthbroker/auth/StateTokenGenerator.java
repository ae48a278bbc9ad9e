package io.sellerlink.oauthbroker.auth;

import java.util.UUID;
import org.springframework.stereotype.Component;

@Component
public class StateTokenGenerator {
  /** 122 random bits from {@code SecureRandom}, rendered as a UUID string. */
  public String nextState() {
    return UUID.randomUUID().toString();
  }
}
