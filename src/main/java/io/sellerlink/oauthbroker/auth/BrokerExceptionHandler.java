package io.sellerlink.oauthbroker.auth;

import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice(basePackages = "io.sellerlink.oauthbroker")
public class BrokerExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(BrokerExceptionHandler.class);

  @ExceptionHandler(BrokerException.class)
  public ResponseEntity<Map<String, Object>> onBrokerError(BrokerException e) {
    Map<String, Object> body = new LinkedHashMap<>();
    if (e.getKind() == BrokerErrorKind.INTERNAL_ERROR || e.getKind() == BrokerErrorKind.CONFIG_ERROR) {
      log.error("broker internal error", e);
      body.put("error", internalMessage(e));
    } else {
      body.put("error", e.getMessage());
    }
    if (e.getDetails() != null) {
      body.put("details", e.getDetails());
    }
    if (!e.getMissingFields().isEmpty()) {
      body.put("missing", e.getMissingFields());
    }
    return ResponseEntity.status(e.getHttpStatus()).body(body);
  }

  // Malformed request bodies land here too.
  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> onUnknown(Exception e) {
    log.error("unhandled request error", e);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", internalMessage(e));
    return ResponseEntity.status(BrokerErrorKind.INTERNAL_ERROR.httpStatus()).body(body);
  }

  private static String internalMessage(Throwable e) {
    String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    return "An error occurred: " + message;
  }
}
