package tech.yump.ledger.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import tech.yump.ledger.audit.AuditHelper;
import tech.yump.ledger.auth.StaticTokenAuthFilter;

import static tech.yump.ledger.auth.LedgerAuthority.LEDGER_READ;
import static tech.yump.ledger.auth.LedgerAuthority.LEDGER_WRITE;
import static tech.yump.ledger.auth.LedgerAuthority.RETENTION_ADMIN;

@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
@Slf4j
public class SecurityConfig {

  private final LedgerProperties ledgerProperties;
  private final AuditHelper auditHelper;

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    LedgerProperties.AuthProperties.StaticTokenAuthProperties staticTokens = ledgerProperties.auth().staticTokens();

    http
            .csrf(AbstractHttpConfigurer::disable)
            .formLogin(AbstractHttpConfigurer::disable)
            .httpBasic(AbstractHttpConfigurer::disable)
            .logout(AbstractHttpConfigurer::disable)
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            // Not a @Bean: Spring Boot would otherwise register it a second time as a servlet filter.
            .addFilterBefore(new StaticTokenAuthFilter(staticTokens, auditHelper), UsernamePasswordAuthenticationFilter.class);

    if (staticTokens.enabled()) {
      log.info("Configuring Spring Security for static token authentication ({} mappings).", staticTokens.mappings().size());
      String read = LEDGER_READ.getAuthority();
      String write = LEDGER_WRITE.getAuthority();
      String admin = RETENTION_ADMIN.getAuthority();
      http
              .exceptionHandling(ex -> ex.authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
              .authorizeHttpRequests(authz -> authz
                      .requestMatchers("/", "/error").permitAll()
                      .requestMatchers("/actuator/health/**", "/actuator/info").permitAll()
                      .requestMatchers("/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html").permitAll()
                      .requestMatchers(HttpMethod.POST, "/v1/ledger/events").hasAuthority(write)
                      .requestMatchers(HttpMethod.GET, "/v1/ledger/**").hasAnyAuthority(read, write)
                      .requestMatchers(HttpMethod.GET, "/v1/retention/**").hasAnyAuthority(read, admin)
                      .requestMatchers("/v1/retention/**").hasAuthority(admin)
                      .anyRequest().authenticated()
              );
    } else {
      log.warn("Static token authentication is disabled (ledger.auth.static-tokens.enabled=false). All API endpoints are accessible without authentication. THIS IS INSECURE FOR PRODUCTION.");
      http.authorizeHttpRequests(authz -> authz.anyRequest().permitAll());
    }

    return http.build();
  }
}
