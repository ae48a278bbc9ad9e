package io.sellerlink.oauthbroker.auth;

import io.sellerlink.oauthbroker.auth.model.PendingState;
import io.sellerlink.oauthbroker.auth.model.RedirectTarget;
import java.net.URI;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class StateIssuer {
  private static final Logger log = LoggerFactory.getLogger(StateIssuer.class);

  private final LwaProperties lwaProperties;
  private final LwaClient lwaClient;
  private final StateTokenGenerator stateTokenGenerator;
  private final BrokerMetrics metrics;
  private final Clock clock;

  public StateIssuer(
      LwaProperties lwaProperties,
      LwaClient lwaClient,
      StateTokenGenerator stateTokenGenerator,
      BrokerMetrics metrics,
      Clock clock) {
    this.lwaProperties = lwaProperties;
    this.lwaClient = lwaClient;
    this.stateTokenGenerator = stateTokenGenerator;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * Binds a fresh nonce into the session, replacing any pending one, and returns the consent URL
   * the caller must be redirected to.
   */
  public RedirectTarget beginAuthorization(AuthorizationSession session) {
    String state = stateTokenGenerator.nextState();
    long now = clock.millis();
    long ttlSeconds = lwaProperties.getStateTtlSeconds();
    long expiresAt = ttlSeconds > 0 ? now + ttlSeconds * 1000 : 0;
    session.bind(new PendingState(state, now, expiresAt));
    log.debug("Generated state {} (expires at {})", state, expiresAt);

    String url = lwaClient.buildAuthorizeUrl(state);
    log.debug("Generated OAuth URL: {}", url);
    metrics.authorizationStarted();
    return new RedirectTarget(URI.create(url), state);
  }
}
