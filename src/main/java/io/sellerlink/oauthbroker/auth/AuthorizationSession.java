package io.sellerlink.oauthbroker.auth;

import io.sellerlink.oauthbroker.auth.model.PendingState;
import java.util.Map;
import java.util.Optional;
import org.springframework.web.server.WebSession;

/**
 * Per-request view of the caller's session attributes. Only the pending OAuth state lives here.
 */
public final class AuthorizationSession {
  public static final String STATE_ATTRIBUTE = "oauth_state";

  private final Map<String, Object> attributes;

  public AuthorizationSession(Map<String, Object> attributes) {
    this.attributes = attributes;
  }

  public static AuthorizationSession of(WebSession session) {
    return new AuthorizationSession(session.getAttributes());
  }

  public void bind(PendingState pendingState) {
    attributes.put(STATE_ATTRIBUTE, pendingState);
  }

  public Optional<PendingState> pendingState() {
    Object value = attributes.get(STATE_ATTRIBUTE);
    if (value instanceof PendingState pending) return Optional.of(pending);
    return Optional.empty();
  }

  public void clear() {
    attributes.remove(STATE_ATTRIBUTE);
  }
}
