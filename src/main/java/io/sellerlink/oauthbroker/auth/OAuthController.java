package io.sellerlink.oauthbroker.auth;

import io.sellerlink.oauthbroker.auth.dto.BrokerDtos;
import io.sellerlink.oauthbroker.auth.model.CallbackParams;
import io.sellerlink.oauthbroker.auth.model.RedirectTarget;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.WebSession;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
public class OAuthController {
  private final OAuthBrokerService brokerService;

  public OAuthController(OAuthBrokerService brokerService) {
    this.brokerService = brokerService;
  }

  @GetMapping("/start-oauth")
  public Mono<ResponseEntity<Void>> startOAuth(WebSession session) {
    return Mono.fromCallable(
            () -> {
              RedirectTarget target = brokerService.startAuthorization(AuthorizationSession.of(session));
              return ResponseEntity.status(HttpStatus.FOUND).location(target.location()).<Void>build();
            })
        .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping(path = "/callback", produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<BrokerDtos.CallbackCheckResponse> checkCallback(
      @RequestParam(value = "spapi_oauth_code", required = false) String code,
      @RequestParam(value = "state", required = false) String state,
      @RequestParam(value = "selling_partner_id", required = false) String sellingPartnerId,
      WebSession session) {
    return Mono.fromCallable(
            () ->
                brokerService.checkCallback(
                    new CallbackParams(code, state, sellingPartnerId), AuthorizationSession.of(session)))
        .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping(path = "/callback", produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<BrokerDtos.MessageResponse> completeCallback(
      @RequestBody BrokerDtos.CallbackRequest request, WebSession session) {
    return Mono.fromCallable(
            () ->
                brokerService.completeCallback(
                    new CallbackParams(request.code(), request.state(), request.sellingPartnerId()),
                    AuthorizationSession.of(session)))
        .subscribeOn(Schedulers.boundedElastic());
  }
}
