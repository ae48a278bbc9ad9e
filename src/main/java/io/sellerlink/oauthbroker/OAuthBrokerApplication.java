package io.sellerlink.oauthbroker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OAuthBrokerApplication {
  public static void main(String[] args) {
    SpringApplication.run(OAuthBrokerApplication.class, args);
  }
}
