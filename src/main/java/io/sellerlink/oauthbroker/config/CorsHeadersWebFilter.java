package io.sellerlink.oauthbroker.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Adds the fixed CORS headers to every response, errors included, and answers preflight
 * {@code OPTIONS} requests directly.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorsHeadersWebFilter implements WebFilter {
  static final String ALLOWED_METHODS = "GET, POST, OPTIONS";
  static final String ALLOWED_HEADERS = "Content-Type, Authorization";

  private final String allowedOrigin;

  public CorsHeadersWebFilter(@Value("${app.cors.allowed-origin}") String allowedOrigin) {
    this.allowedOrigin = allowedOrigin;
  }

  @Override
  public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
    exchange
        .getResponse()
        .beforeCommit(
            () -> {
              HttpHeaders headers = exchange.getResponse().getHeaders();
              headers.set(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, allowedOrigin);
              headers.set(HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS, ALLOWED_METHODS);
              headers.set(HttpHeaders.ACCESS_CONTROL_ALLOW_HEADERS, ALLOWED_HEADERS);
              headers.set(HttpHeaders.ACCESS_CONTROL_ALLOW_CREDENTIALS, "true");
              return Mono.empty();
            });
    if (HttpMethod.OPTIONS.equals(exchange.getRequest().getMethod())) {
      exchange.getResponse().setStatusCode(HttpStatus.OK);
      return exchange.getResponse().setComplete();
    }
    return chain.filter(exchange);
  }
}
