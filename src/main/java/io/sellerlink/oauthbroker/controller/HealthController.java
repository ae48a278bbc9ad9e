package io.sellerlink.oauthbroker.controller;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
public class HealthController {
  @GetMapping(path = "/", produces = MediaType.TEXT_PLAIN_VALUE)
  public Mono<String> home() {
    return Mono.just("OAuth broker is running.");
  }
}
