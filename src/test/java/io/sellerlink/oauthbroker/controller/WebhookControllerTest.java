package io.sellerlink.oauthbroker.controller;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import io.sellerlink.oauthbroker.auth.BrokerMetrics;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

@WebFluxTest(controllers = {WebhookController.class, HealthController.class})
class WebhookControllerTest {
  @Autowired private WebTestClient webTestClient;

  @MockBean private BrokerMetrics metrics;

  @Test
  void acceptsArbitraryJson() {
    webTestClient
        .post()
        .uri("/webhook")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue("{\"triggerType\":\"form_submission\",\"payload\":{\"name\":\"Seller\",\"data\":[1,2]}}")
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .json("{\"message\":\"Webhook received successfully\"}");

    verify(metrics).webhookReceived();
  }

  @Test
  void acceptsJsonArray() {
    webTestClient
        .post()
        .uri("/webhook")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue("[{\"id\":1}]")
        .exchange()
        .expectStatus()
        .isOk();
  }

  @Test
  void unparseableBodyIsServerError() {
    webTestClient
        .post()
        .uri("/webhook")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue("{\"unterminated\":")
        .exchange()
        .expectStatus()
        .isEqualTo(500)
        .expectBody()
        .jsonPath("$.error")
        .exists();

    verify(metrics, never()).webhookReceived();
  }

  @Test
  void everyResponseCarriesCorsHeaders() {
    webTestClient
        .get()
        .uri("/")
        .exchange()
        .expectStatus()
        .isOk()
        .expectHeader()
        .valueEquals(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "https://front.example.com")
        .expectHeader()
        .valueEquals(HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS, "GET, POST, OPTIONS")
        .expectHeader()
        .valueEquals(HttpHeaders.ACCESS_CONTROL_ALLOW_HEADERS, "Content-Type, Authorization")
        .expectBody(String.class)
        .isEqualTo("OAuth broker is running.");
  }

  @Test
  void errorResponsesCarryCorsHeadersToo() {
    webTestClient
        .post()
        .uri("/webhook")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue("nope")
        .exchange()
        .expectStatus()
        .isEqualTo(500)
        .expectHeader()
        .valueEquals(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "https://front.example.com");
  }

  @Test
  void preflightIsAnsweredDirectly() {
    webTestClient
        .options()
        .uri("/callback")
        .header(HttpHeaders.ORIGIN, "https://front.example.com")
        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST")
        .exchange()
        .expectStatus()
        .isOk()
        .expectHeader()
        .valueEquals(HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS, "GET, POST, OPTIONS")
        .expectHeader()
        .valueEquals(HttpHeaders.ACCESS_CONTROL_ALLOW_CREDENTIALS, "true");
  }
}
