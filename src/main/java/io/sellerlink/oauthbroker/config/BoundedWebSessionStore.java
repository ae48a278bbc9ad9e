package io.sellerlink.oauthbroker.config;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.server.WebSession;
import org.springframework.web.server.session.InMemoryWebSessionStore;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * In-memory session store with a short idle timeout and a soft cap. When the cap is reached the
 * least recently used sessions are dropped to make room, so new callers are never refused.
 */
public class BoundedWebSessionStore extends InMemoryWebSessionStore {
  private static final Logger log = LoggerFactory.getLogger(BoundedWebSessionStore.class);

  private final int maxSessions;
  private final Duration maxIdleTime;

  public BoundedWebSessionStore(int maxSessions, Duration maxIdleTime) {
    if (maxSessions < 1) {
      throw new IllegalArgumentException("maxSessions must be at least 1");
    }
    this.maxSessions = maxSessions;
    this.maxIdleTime = maxIdleTime;
    // The cap is enforced here on creation; the parent's hard limit would reject saves instead.
    super.setMaxSessions(Integer.MAX_VALUE);
  }

  public int getSessionLimit() {
    return maxSessions;
  }

  public Duration getMaxIdleTime() {
    return maxIdleTime;
  }

  @Override
  public Mono<WebSession> createWebSession() {
    return evictIfFull()
        .then(super.createWebSession())
        .doOnNext(session -> session.setMaxIdleTime(maxIdleTime));
  }

  private Mono<Void> evictIfFull() {
    return Mono.defer(
        () -> {
          if (getSessions().size() < maxSessions) return Mono.empty();
          removeExpiredSessions();
          Map<String, WebSession> sessions = getSessions();
          int excess = sessions.size() - maxSessions + 1;
          if (excess <= 0) return Mono.empty();
          List<String> oldest =
              sessions.values().stream()
                  .sorted(Comparator.comparing(WebSession::getLastAccessTime))
                  .limit(excess)
                  .map(WebSession::getId)
                  .toList();
          log.warn("Session store full ({}), evicting {} least recently used", maxSessions, oldest.size());
          return Flux.fromIterable(oldest).concatMap(this::removeSession).then();
        });
  }
}
