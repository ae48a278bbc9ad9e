package io.sellerlink.oauthbroker.auth;

import io.sellerlink.oauthbroker.auth.dto.BrokerDtos;
import io.sellerlink.oauthbroker.auth.model.CallbackParams;
import io.sellerlink.oauthbroker.auth.model.RedirectTarget;
import io.sellerlink.oauthbroker.auth.model.ValidatedCallback;
import org.springframework.stereotype.Service;

@Service
public class OAuthBrokerService {
  private final StateIssuer stateIssuer;
  private final CallbackValidator callbackValidator;
  private final TokenExchanger tokenExchanger;

  public OAuthBrokerService(
      StateIssuer stateIssuer, CallbackValidator callbackValidator, TokenExchanger tokenExchanger) {
    this.stateIssuer = stateIssuer;
    this.callbackValidator = callbackValidator;
    this.tokenExchanger = tokenExchanger;
  }

  public RedirectTarget startAuthorization(AuthorizationSession session) {
    return stateIssuer.beginAuthorization(session);
  }

  public BrokerDtos.CallbackCheckResponse checkCallback(CallbackParams params, AuthorizationSession session) {
    ValidatedCallback callback = callbackValidator.validate(CallbackMethod.GET, params, session);
    return new BrokerDtos.CallbackCheckResponse("GET request successful", callback.code());
  }

  public BrokerDtos.MessageResponse completeCallback(CallbackParams params, AuthorizationSession session) {
    ValidatedCallback callback = callbackValidator.validate(CallbackMethod.POST, params, session);
    // The nonce is single use once a POST passes validation, whatever the exchange outcome.
    session.clear();
    tokenExchanger.exchangeCode(callback.code(), callback.partnerId());
    return new BrokerDtos.MessageResponse("Authorization successful");
  }
}
