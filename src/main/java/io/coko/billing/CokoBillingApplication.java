package io.coko.billing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.oauth2.resource.servlet.OAuth2ResourceServerAutoConfiguration;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Coko billing and royalty engine: payment ledger, invoicing, recurring billing and author royalties.
 */
@SpringBootApplication(exclude = {
    // imported by SecurityConfig once an issuer URI is set
    OAuth2ResourceServerAutoConfiguration.class
})
@EnableRetry
public class CokoBillingApplication {

  public static void main(String[] args) {
    SpringApplication.run(CokoBillingApplication.class, args);
  }
}
