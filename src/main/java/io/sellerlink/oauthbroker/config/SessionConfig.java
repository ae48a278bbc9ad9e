package io.sellerlink.oauthbroker.config;

import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.server.adapter.WebHttpHandlerBuilder;
import org.springframework.web.server.session.DefaultWebSessionManager;
import org.springframework.web.server.session.WebSessionIdResolver;
import org.springframework.web.server.session.WebSessionManager;
import org.springframework.web.server.session.WebSessionStore;

/**
 * Server-side sessions keyed by a signed cookie.
 *
 * <p>The cookie is {@code SameSite=None; Secure} so it survives the cross-site redirect back from
 * Seller Central, and has no max-age. Sessions live in memory, idle out after
 * {@code app.session.max-idle-seconds} and are capped at {@code app.session.max-sessions}, with
 * the least recently used evicted first. They do not survive a restart; swap the
 * {@link WebSessionStore} bean for a shared store when running more than one instance.
 */
@Configuration
public class SessionConfig {

  @Bean
  public WebSessionStore webSessionStore(
      @Value("${app.session.max-sessions:10000}") int maxSessions,
      @Value("${app.session.max-idle-seconds:600}") long maxIdleSeconds) {
    return new BoundedWebSessionStore(maxSessions, Duration.ofSeconds(Math.max(1, maxIdleSeconds)));
  }

  @Bean
  public WebSessionIdResolver webSessionIdResolver(
      @Value("${app.session.signing-secret}") String signingSecret,
      @Value("${app.session.cookie-name:session}") String cookieName) {
    SignedCookieWebSessionIdResolver resolver =
        new SignedCookieWebSessionIdResolver(new SessionIdSigner(signingSecret));
    resolver.setCookieName(cookieName);
    resolver.addCookieInitializer(
        builder -> {
          builder.httpOnly(true);
          builder.secure(true);
          builder.sameSite("None");
          builder.path("/");
        });
    return resolver;
  }

  @Bean(name = WebHttpHandlerBuilder.WEB_SESSION_MANAGER_BEAN_NAME)
  public WebSessionManager webSessionManager(
      WebSessionIdResolver webSessionIdResolver, WebSessionStore webSessionStore) {
    DefaultWebSessionManager manager = new DefaultWebSessionManager();
    manager.setSessionIdResolver(webSessionIdResolver);
    manager.setSessionStore(webSessionStore);
    return manager;
  }
}
