package io.sellerlink.oauthbroker.auth;

import io.sellerlink.oauthbroker.auth.model.PartnerCredential;
import io.sellerlink.oauthbroker.auth.model.TokenEndpointResponse;
import io.sellerlink.oauthbroker.auth.model.UpsertResult;
import io.sellerlink.oauthbroker.store.CredentialStore;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class TokenExchanger {
  private static final Logger log = LoggerFactory.getLogger(TokenExchanger.class);

  private final LwaClient lwaClient;
  private final CredentialStore store;
  private final BrokerMetrics metrics;
  private final Clock clock;

  public TokenExchanger(LwaClient lwaClient, CredentialStore store, BrokerMetrics metrics, Clock clock) {
    this.lwaClient = lwaClient;
    this.store = store;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * Trades an authorization code for a refresh token and upserts it for {@code partnerId}. Nothing
   * is written unless the token endpoint answers 200 with a refresh token.
   */
  public PartnerCredential exchangeCode(String code, String partnerId) {
    TokenEndpointResponse response = lwaClient.requestAuthorizationCodeGrant(code);
    if (!response.isOk()) {
      log.error(
          "Token exchange failed for partner {}: status {}, body {}",
          partnerId,
          response.status(),
          response.payload());
      metrics.exchangeFailure("provider_rejected");
      throw BrokerException.upstream("Failed to exchange authorization code", response.payload());
    }
    String refreshToken = response.field("refresh_token");
    if (refreshToken.isBlank()) {
      log.error("Token response for partner {} did not include a refresh_token", partnerId);
      metrics.exchangeFailure("refresh_token_missing");
      throw BrokerException.upstream("Token response did not include a refresh_token", null);
    }

    UpsertResult result = store.upsert(partnerId, refreshToken, clock.millis());
    metrics.exchangeSuccess(result.created());
    log.info("Stored credential for partner {} ({})", partnerId, result.created() ? "created" : "updated");
    return result.credential();
  }

  /** Read-through to the token endpoint; never touches the credential store. */
  public Optional<String> refreshAccessToken(String refreshToken) {
    TokenEndpointResponse response;
    try {
      response = lwaClient.requestRefreshTokenGrant(refreshToken);
    } catch (BrokerException e) {
      log.error("Error refreshing access token", e);
      metrics.refreshFailure("transport");
      return Optional.empty();
    }
    if (!response.isOk()) {
      log.error("Failed to refresh access token: status {}, body {}", response.status(), response.payload());
      metrics.refreshFailure("provider_rejected");
      return Optional.empty();
    }
    String accessToken = response.field("access_token");
    if (accessToken.isBlank()) {
      log.error("Refresh response did not include an access_token");
      metrics.refreshFailure("access_token_missing");
      return Optional.empty();
    }
    return Optional.of(accessToken);
  }
}
