package io.sellerlink.oauthbroker.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public final class BrokerDtos {
  private BrokerDtos() {}

  public record CallbackRequest(
      String code, String state, @JsonProperty("selling_partner_id") String sellingPartnerId) {}

  public record CallbackCheckResponse(String message, @JsonProperty("auth_code") String authCode) {}

  public record MessageResponse(String message) {}
}
