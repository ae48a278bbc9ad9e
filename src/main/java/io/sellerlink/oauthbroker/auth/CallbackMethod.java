package io.sellerlink.oauthbroker.auth;

/** The two callback shapes. They differ in the wire name of the authorization code. */
public enum CallbackMethod {
  GET("spapi_oauth_code"),
  POST("code");

  private final String codeField;

  CallbackMethod(String codeField) {
    this.codeField = codeField;
  }

  public String codeField() {
    return codeField;
  }
}
