package io.sellerlink.oauthbroker.auth;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Login with Amazon application settings. The application id, client secret and redirect URI
 * have no defaults; a blank value fails binding and the service refuses to start.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "app.lwa")
public class LwaProperties {
  @NotBlank private String appId;
  @NotBlank private String clientSecret;
  @NotBlank private String redirectUri;

  @NotBlank
  private String authorizeEndpoint = "https://sellercentral.amazon.com.mx/apps/authorize/consent";

  @NotBlank private String tokenEndpoint = "https://api.amazon.com/auth/o2/token";
  private String version = "beta";
  private long stateTtlSeconds = 600;
  private long tokenTimeoutSeconds = 15;
  private boolean metricsEnabled = true;

  public String getAppId() {
    return appId;
  }

  public void setAppId(String appId) {
    this.appId = appId;
  }

  public String getClientSecret() {
    return clientSecret;
  }

  public void setClientSecret(String clientSecret) {
    this.clientSecret = clientSecret;
  }

  public String getRedirectUri() {
    return redirectUri;
  }

  public void setRedirectUri(String redirectUri) {
    this.redirectUri = redirectUri;
  }

  public String getAuthorizeEndpoint() {
    return authorizeEndpoint;
  }

  public void setAuthorizeEndpoint(String authorizeEndpoint) {
    this.authorizeEndpoint = authorizeEndpoint;
  }

  public String getTokenEndpoint() {
    return tokenEndpoint;
  }

  public void setTokenEndpoint(String tokenEndpoint) {
    this.tokenEndpoint = tokenEndpoint;
  }

  public String getVersion() {
    return version;
  }

  public void setVersion(String version) {
    this.version = version;
  }

  public long getStateTtlSeconds() {
    return stateTtlSeconds;
  }

  public void setStateTtlSeconds(long stateTtlSeconds) {
    this.stateTtlSeconds = stateTtlSeconds;
  }

  public long getTokenTimeoutSeconds() {
    return tokenTimeoutSeconds;
  }

  public void setTokenTimeoutSeconds(long tokenTimeoutSeconds) {
    this.tokenTimeoutSeconds = tokenTimeoutSeconds;
  }

  public boolean isMetricsEnabled() {
    return metricsEnabled;
  }

  public void setMetricsEnabled(boolean metricsEnabled) {
    this.metricsEnabled = metricsEnabled;
  }
}
