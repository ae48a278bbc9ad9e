package io.sellerlink.oauthbroker.auth;

import java.util.List;

public class BrokerException extends RuntimeException {
  private final BrokerErrorKind kind;
  private final Object details;
  private final List<String> missingFields;

  public BrokerException(BrokerErrorKind kind, String message) {
    this(kind, message, null, List.of(), null);
  }

  public BrokerException(BrokerErrorKind kind, String message, Throwable cause) {
    this(kind, message, null, List.of(), cause);
  }

  public BrokerException(BrokerErrorKind kind, String message, Object details) {
    this(kind, message, details, List.of(), null);
  }

  public BrokerException(
      BrokerErrorKind kind,
      String message,
      Object details,
      List<String> missingFields,
      Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.details = details;
    this.missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
  }

  public static BrokerException validation(String message) {
    return new BrokerException(BrokerErrorKind.VALIDATION_ERROR, message);
  }

  public static BrokerException missingFields(String message, List<String> missingFields) {
    return new BrokerException(BrokerErrorKind.VALIDATION_ERROR, message, null, missingFields, null);
  }

  public static BrokerException upstream(String message, Object providerPayload) {
    return new BrokerException(BrokerErrorKind.UPSTREAM_ERROR, message, providerPayload);
  }

  public BrokerErrorKind getKind() {
    return kind;
  }

  public int getHttpStatus() {
    return kind.httpStatus();
  }

  /** Provider payload surfaced to the caller, or {@code null}. */
  public Object getDetails() {
    return details;
  }

  public List<String> getMissingFields() {
    return missingFields;
  }
}
