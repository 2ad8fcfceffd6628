package tech.yump.ledger.auth;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;
import tech.yump.ledger.audit.AuditHelper;
import tech.yump.ledger.config.LedgerProperties.AuthProperties.StaticTokenAuthProperties;
import tech.yump.ledger.config.LedgerProperties.AuthProperties.StaticTokenMapping;
import tech.yump.ledger.event.Outcome;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Authenticates requests carrying a configured static token in {@value #LEDGER_TOKEN_HEADER}.
 * <p>
 * The authenticated principal is the mapping name (never the token) and the granted authorities are the
 * mapping's {@link LedgerAuthority} values. Every request gets a request id, exposed as a request attribute
 * and in the logging MDC.
 */
@Slf4j
public class StaticTokenAuthFilter extends OncePerRequestFilter {

  public static final String LEDGER_TOKEN_HEADER = "X-Ledger-Token";
  public static final String REQUEST_ID_ATTR = "auditRequestId";
  public static final String MDC_REQUEST_ID_KEY = "requestId";

  private final boolean staticAuthEnabled;
  private final List<StaticTokenMapping> tokenMappings;
  private final AuditHelper auditHelper;

  public StaticTokenAuthFilter(StaticTokenAuthProperties staticTokenProps, AuditHelper auditHelper) {
    this.staticAuthEnabled = Optional.ofNullable(staticTokenProps)
            .map(StaticTokenAuthProperties::enabled)
            .orElse(false);
    this.tokenMappings = Optional.ofNullable(staticTokenProps)
            .map(StaticTokenAuthProperties::mappings)
            .orElse(Collections.emptyList());
    this.auditHelper = auditHelper;

    log.debug("StaticTokenAuthFilter initialized. Enabled: {}, Mappings count: {}",
            this.staticAuthEnabled, this.tokenMappings.size());
  }

  @Override
  protected void doFilterInternal(
          @NonNull HttpServletRequest request,
          @NonNull HttpServletResponse response,
          @NonNull FilterChain filterChain) throws ServletException, IOException {

    String requestId = UUID.randomUUID().toString();
    request.setAttribute(REQUEST_ID_ATTR, requestId);
    MDC.put(MDC_REQUEST_ID_KEY, requestId);

    try {
      String tokenHeader = request.getHeader(LEDGER_TOKEN_HEADER);
      if (!staticAuthEnabled || !StringUtils.hasText(tokenHeader)
              || SecurityContextHolder.getContext().getAuthentication() != null) {
        filterChain.doFilter(request, response);
        return;
      }

      Optional<StaticTokenMapping> mapping = findMapping(tokenHeader.trim());
      if (mapping.isPresent()) {
        StaticTokenMapping match = mapping.get();
        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                match.name(),
                null,
                List.copyOf(match.authorities())
        );
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
        log.debug("Authenticated '{}' for {} {} with {}", match.name(), request.getMethod(), request.getRequestURI(), match.authorities());

        auditHelper.logHttpEvent("auth", "token_validation", Outcome.SUCCESS, null, null,
                Map.of("mapping_name", match.name()));
      } else {
        log.warn("Invalid or unknown static token received for {} {}", request.getMethod(), request.getRequestURI());
        auditHelper.logHttpEvent("auth", "token_validation", Outcome.FAILURE, HttpServletResponse.SC_UNAUTHORIZED,
                "invalid token", Map.of("reason", "invalid_token"));
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_REQUEST_ID_KEY);
    }
  }

  private Optional<StaticTokenMapping> findMapping(String providedToken) {
    byte[] provided = providedToken.getBytes(StandardCharsets.UTF_8);
    return tokenMappings.stream()
            .filter(m -> MessageDigest.isEqual(provided, m.token().getBytes(StandardCharsets.UTF_8)))
            .findFirst();
  }
}
