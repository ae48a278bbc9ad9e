package io.sellerlink.oauthbroker.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.sellerlink.oauthbroker.auth.model.TokenEndpointResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

/** Login with Amazon endpoints: the consent URL and the token endpoint. */
@Service
public class LwaClient {
  private final WebClient webClient;
  private final LwaProperties lwaProperties;
  private final ObjectMapper objectMapper;

  public LwaClient(WebClient webClient, LwaProperties lwaProperties, ObjectMapper objectMapper) {
    this.webClient = webClient;
    this.lwaProperties = lwaProperties;
    this.objectMapper = objectMapper;
  }

  public String buildAuthorizeUrl(String state) {
    return UriComponentsBuilder.fromUriString(lwaProperties.getAuthorizeEndpoint())
        .queryParam("application_id", lwaProperties.getAppId())
        .queryParam("state", state)
        .queryParam("version", lwaProperties.getVersion())
        .queryParam("redirect_uri", lwaProperties.getRedirectUri())
        .build()
        .encode(StandardCharsets.UTF_8)
        .toUriString();
  }

  public TokenEndpointResponse requestAuthorizationCodeGrant(String code) {
    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("grant_type", "authorization_code");
    form.add("code", code);
    form.add("redirect_uri", lwaProperties.getRedirectUri());
    form.add("client_id", lwaProperties.getAppId());
    form.add("client_secret", lwaProperties.getClientSecret());
    return postTokenForm(form);
  }

  public TokenEndpointResponse requestRefreshTokenGrant(String refreshToken) {
    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("grant_type", "refresh_token");
    form.add("refresh_token", refreshToken);
    form.add("client_id", lwaProperties.getAppId());
    form.add("client_secret", lwaProperties.getClientSecret());
    return postTokenForm(form);
  }

  // Single attempt, bounded by the configured timeout. Non-200 answers are returned, not thrown.
  private TokenEndpointResponse postTokenForm(MultiValueMap<String, String> form) {
    TokenEndpointResponse response;
    try {
      response =
          webClient
              .post()
              .uri(lwaProperties.getTokenEndpoint())
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .body(BodyInserters.fromFormData(form))
              .exchangeToMono(
                  clientResponse ->
                      clientResponse
                          .bodyToMono(String.class)
                          .defaultIfEmpty("")
                          .map(
                              body ->
                                  new TokenEndpointResponse(
                                      clientResponse.statusCode().value(), parseJson(body), body)))
              .timeout(Duration.ofSeconds(Math.max(1, lwaProperties.getTokenTimeoutSeconds())))
              .block();
    } catch (Exception e) {
      throw new BrokerException(
          BrokerErrorKind.INTERNAL_ERROR, "token endpoint request failed: " + describe(e), e);
    }
    if (response == null) {
      throw new BrokerException(BrokerErrorKind.INTERNAL_ERROR, "token endpoint returned no response");
    }
    return response;
  }

  private JsonNode parseJson(String body) {
    if (body == null || body.isBlank()) return null;
    try {
      return objectMapper.readTree(body);
    } catch (Exception e) {
      return null;
    }
  }

  private static String describe(Exception e) {
    Throwable root = e.getCause() != null && e.getMessage() == null ? e.getCause() : e;
    return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
  }
}
