package io.sellerlink.oauthbroker.auth;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class BrokerMetrics {
  private final MeterRegistry meterRegistry;
  private final LwaProperties lwaProperties;

  public BrokerMetrics(MeterRegistry meterRegistry, LwaProperties lwaProperties) {
    this.meterRegistry = meterRegistry;
    this.lwaProperties = lwaProperties;
  }

  public void authorizationStarted() {
    if (!lwaProperties.isMetricsEnabled()) return;
    meterRegistry.counter("broker.authorization.started").increment();
  }

  public void callbackRejected(CallbackMethod method, String reason) {
    if (!lwaProperties.isMetricsEnabled()) return;
    meterRegistry.counter("broker.callback.rejected", "method", method.name(), "reason", reason).increment();
  }

  public void exchangeSuccess(boolean created) {
    if (!lwaProperties.isMetricsEnabled()) return;
    meterRegistry.counter("broker.exchange.success", "result", created ? "created" : "updated").increment();
  }

  public void exchangeFailure(String reason) {
    if (!lwaProperties.isMetricsEnabled()) return;
    meterRegistry.counter("broker.exchange.failure", "reason", reason).increment();
  }

  public void refreshFailure(String reason) {
    if (!lwaProperties.isMetricsEnabled()) return;
    meterRegistry.counter("broker.refresh.failure", "reason", reason).increment();
  }

  public void webhookReceived() {
    if (!lwaProperties.isMetricsEnabled()) return;
    meterRegistry.counter("broker.webhook.received").increment();
  }
}
