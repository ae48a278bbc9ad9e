package io.sellerlink.oauthbroker.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

@Component
public class RequestLoggingWebFilter implements WebFilter {
  private static final Logger log = LoggerFactory.getLogger(RequestLoggingWebFilter.class);

  @Override
  public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
    if (log.isDebugEnabled()) {
      // Query strings carry authorization codes; log the path only.
      log.debug(
          "{} {}", exchange.getRequest().getMethod(), exchange.getRequest().getURI().getPath());
    }
    return chain.filter(exchange);
  }
}
