package io.sellerlink.oauthbroker.config;

import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.session.CookieWebSessionIdResolver;

/**
 * Cookie resolver that signs the session id on the way out and drops cookies whose signature does
 * not verify on the way in. A dropped cookie simply means a new session.
 */
public class SignedCookieWebSessionIdResolver extends CookieWebSessionIdResolver {
  private static final Logger log = LoggerFactory.getLogger(SignedCookieWebSessionIdResolver.class);

  private final SessionIdSigner signer;

  public SignedCookieWebSessionIdResolver(SessionIdSigner signer) {
    this.signer = signer;
  }

  @Override
  public List<String> resolveSessionIds(ServerWebExchange exchange) {
    List<String> raw = super.resolveSessionIds(exchange);
    List<String> verified = raw.stream().map(signer::unsign).flatMap(Optional::stream).toList();
    if (verified.size() < raw.size()) {
      log.debug("Ignored {} session cookie(s) with an invalid signature", raw.size() - verified.size());
    }
    return verified;
  }

  @Override
  public void setSessionId(ServerWebExchange exchange, String id) {
    Assert.notNull(id, "'id' is required");
    super.setSessionId(exchange, signer.sign(id));
  }
}
