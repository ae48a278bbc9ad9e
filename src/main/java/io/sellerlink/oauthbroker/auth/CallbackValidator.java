package io.sellerlink.oauthbroker.auth;

import io.sellerlink.oauthbroker.auth.model.CallbackParams;
import io.sellerlink.oauthbroker.auth.model.PendingState;
import io.sellerlink.oauthbroker.auth.model.ValidatedCallback;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Anti-CSRF check for the provider callback. The state comparison always runs before the
 * required-field check, so a request with a wrong state is a state error whatever else is missing.
 */
@Service
public class CallbackValidator {
  private static final Logger log = LoggerFactory.getLogger(CallbackValidator.class);

  private final BrokerMetrics metrics;
  private final Clock clock;

  public CallbackValidator(BrokerMetrics metrics, Clock clock) {
    this.metrics = metrics;
    this.clock = clock;
  }

  public ValidatedCallback validate(
      CallbackMethod method, CallbackParams params, AuthorizationSession session) {
    log.debug(
        "Received {} callback: code={}, state={}, selling_partner_id={}",
        method,
        params.code(),
        params.state(),
        params.partnerId());

    Optional<PendingState> pending = session.pendingState();
    String expected = pending.map(PendingState::state).orElse(null);
    if (expected == null || !expected.equals(params.state())) {
      log.warn("State mismatch on {} callback: expected {}, got {}", method, expected, params.state());
      metrics.callbackRejected(method, expected == null ? "state_unbound" : "state_mismatch");
      throw BrokerException.validation(invalidStateMessage(method));
    }
    if (pending.get().isExpired(clock.millis())) {
      log.warn("State {} expired at {}", expected, pending.get().expiresAt());
      metrics.callbackRejected(method, "state_expired");
      throw BrokerException.validation(invalidStateMessage(method));
    }

    List<String> missing = new ArrayList<>();
    if (isEmpty(params.code())) missing.add(method.codeField());
    if (isEmpty(params.state())) missing.add("state");
    if (isEmpty(params.partnerId())) missing.add("selling_partner_id");
    if (!missing.isEmpty()) {
      log.warn("Missing parameters on {} callback: {}", method, missing);
      metrics.callbackRejected(method, "missing_fields");
      throw BrokerException.missingFields(
          "Missing required parameters in " + method.name() + " request", missing);
    }
    return new ValidatedCallback(params.code(), params.state(), params.partnerId());
  }

  private static String invalidStateMessage(CallbackMethod method) {
    return "Invalid state parameter in " + method.name() + " request";
  }

  private static boolean isEmpty(String value) {
    return value == null || value.isEmpty();
  }
}
