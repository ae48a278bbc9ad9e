package io.sellerlink.oauthbroker.auth;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class LwaPropertiesTest {
  private final ApplicationContextRunner runner =
      new ApplicationContextRunner()
          .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
          .withUserConfiguration(PropertiesConfig.class);

  @Configuration
  @EnableConfigurationProperties(LwaProperties.class)
  static class PropertiesConfig {}

  @Test
  void bindsRequiredSecretsAndKeepsDefaults() {
    runner
        .withPropertyValues(
            "app.lwa.app-id=amzn1.sp.solution.app",
            "app.lwa.client-secret=secret",
            "app.lwa.redirect-uri=https://broker.example.com/callback")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              LwaProperties properties = context.getBean(LwaProperties.class);
              assertThat(properties.getAppId()).isEqualTo("amzn1.sp.solution.app");
              assertThat(properties.getTokenEndpoint()).isEqualTo("https://api.amazon.com/auth/o2/token");
              assertThat(properties.getVersion()).isEqualTo("beta");
              assertThat(properties.getStateTtlSeconds()).isEqualTo(600);
              assertThat(properties.getTokenTimeoutSeconds()).isEqualTo(15);
            });
  }

  @Test
  void refusesToStartWithoutClientSecret() {
    runner
        .withPropertyValues(
            "app.lwa.app-id=amzn1.sp.solution.app",
            "app.lwa.redirect-uri=https://broker.example.com/callback")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void refusesToStartWithBlankRedirectUri() {
    runner
        .withPropertyValues(
            "app.lwa.app-id=amzn1.sp.solution.app",
            "app.lwa.client-secret=secret",
            "app.lwa.redirect-uri= ")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void refusesToStartWhenAppIdEnvironmentVariableIsUnset() {
    runner
        .withPropertyValues(
            "app.lwa.app-id=${BROKER_UNSET_LWA_APP_ID:}",
            "app.lwa.client-secret=secret",
            "app.lwa.redirect-uri=https://broker.example.com/callback")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void refusesToStartWhenSecretEnvironmentVariablesAreUnset() {
    runner
        .withPropertyValues(
            "app.lwa.app-id=amzn1.sp.solution.app",
            "app.lwa.client-secret=${BROKER_UNSET_LWA_CLIENT_SECRET:}",
            "app.lwa.redirect-uri=${BROKER_UNSET_REDIRECT_URI:}")
        .run(context -> assertThat(context).hasFailed());
  }
}
