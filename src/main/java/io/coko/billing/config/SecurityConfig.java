package io.coko.billing.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.security.oauth2.resource.servlet.OAuth2ResourceServerAutoConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationConverter;
import org.springframework.security.web.SecurityFilterChain;

/**
 * JWT protected API, enabled by setting OAUTH2_ISSUER_URI.
 *
 * Reader-facing endpoints (invoices, subscriptions, royalty statements) need any valid token.
 * Money-moving operations (config writes, royalty payouts and computations, renewal runs, DLQ)
 * need the {@value #ADMIN_AUTHORITY} scope. Provider webhooks stay public: they authenticate
 * through their own signatures.
 */
@Configuration
@ConditionalOnProperty(
    prefix = "spring.security.oauth2.resourceserver.jwt",
    name = "issuer-uri"
)
@Import(OAuth2ResourceServerAutoConfiguration.class)
@EnableWebSecurity
public class SecurityConfig {

    public static final String ADMIN_AUTHORITY = "SCOPE_billing.admin";

    @Bean("oauth2SecurityFilterChain")
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            .csrf(csrf -> csrf.disable())
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/actuator/health", "/actuator/info").permitAll()
                .requestMatchers("/api/webhooks/**").permitAll()
                .requestMatchers("/actuator/**").hasAuthority(ADMIN_AUTHORITY)
                .requestMatchers("/api/billing/**").hasAuthority(ADMIN_AUTHORITY)
                .requestMatchers(HttpMethod.POST, "/api/config/**", "/api/config").hasAuthority(ADMIN_AUTHORITY)
                .requestMatchers(HttpMethod.POST, "/api/royalties/compute", "/api/royalties/*/paid",
                    "/api/royalties/*/invoices")
                    .hasAuthority(ADMIN_AUTHORITY)
                .anyRequest().authenticated()
            )
            .oauth2ResourceServer(oauth2 -> oauth2.jwt(jwt -> jwt.jwtAuthenticationConverter(jwtAuthenticationConverter())));

        return http.build();
    }

    /**
     * Audit rows record the caller's username rather than the opaque subject id.
     */
    private static JwtAuthenticationConverter jwtAuthenticationConverter() {
        JwtAuthenticationConverter converter = new JwtAuthenticationConverter();
        converter.setPrincipalClaimName("preferred_username");
        return converter;
    }
}
