package io.sellerlink.oauthbroker.controller;

import com.fasterxml.jackson.databind.JsonNode;
import io.sellerlink.oauthbroker.auth.BrokerMetrics;
import io.sellerlink.oauthbroker.auth.dto.BrokerDtos;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/** Accepts any JSON payload. No signature verification is performed. */
@RestController
public class WebhookController {
  private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

  private final BrokerMetrics metrics;

  public WebhookController(BrokerMetrics metrics) {
    this.metrics = metrics;
  }

  @PostMapping(path = "/webhook", produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<BrokerDtos.MessageResponse> receive(@RequestBody JsonNode payload) {
    log.debug("Webhook data received: {}", payload);
    metrics.webhookReceived();
    return Mono.just(new BrokerDtos.MessageResponse("Webhook received successfully"));
  }
}
