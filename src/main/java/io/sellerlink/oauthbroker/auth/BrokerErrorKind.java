package io.sellerlink.oauthbroker.auth;

public enum BrokerErrorKind {
  CONFIG_ERROR(500),
  VALIDATION_ERROR(400),
  UPSTREAM_ERROR(400),
  INTERNAL_ERROR(500);

  private final int httpStatus;

  BrokerErrorKind(int httpStatus) {
    this.httpStatus = httpStatus;
  }

  public int httpStatus() {
    return httpStatus;
  }
}
