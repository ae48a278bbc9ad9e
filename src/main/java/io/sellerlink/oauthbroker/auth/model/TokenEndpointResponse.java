package io.sellerlink.oauthbroker.auth.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raw answer of the token endpoint. {@code json} is null when the body is not JSON, in which case
 * {@link #payload()} falls back to the raw text.
 */
public record TokenEndpointResponse(int status, JsonNode json, String rawBody) {
  public boolean isOk() {
    return status == 200;
  }

  public String field(String name) {
    if (json == null) return "";
    return json.path(name).asText("");
  }

  public Object payload() {
    return json != null ? json : rawBody;
  }
}
