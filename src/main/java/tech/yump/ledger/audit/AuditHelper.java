package tech.yump.ledger.audit;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import tech.yump.ledger.auth.StaticTokenAuthFilter;
import tech.yump.ledger.event.Outcome;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class AuditHelper {

    private final AuditBackend auditBackend;
    private final Clock clock;

    /**
     * Logs the outcome of an HTTP request, with the caller and request taken from the current context.
     *
     * @param type         area of the API ("ledger", "retention", "policy", "request_error").
     * @param action       what was attempted ("append", "verify", "update_policy", ...).
     * @param outcome      success or failure.
     * @param statusCode   HTTP status sent back, null while the response is still undecided.
     * @param errorMessage optional message for failures.
     * @param data         optional context, such as a policy id.
     */
    public void logHttpEvent(
            String type,
            String action,
            Outcome outcome,
            @Nullable Integer statusCode,
            @Nullable String errorMessage,
            @Nullable Map<String, Object> data) {

        HttpServletRequest request = getCurrentHttpRequest();
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        AuditEvent.AuthInfo authInfo = buildAuthInfo(authentication, request);
        AuditEvent.RequestInfo requestInfo = buildRequestInfo(request);
        AuditEvent.ResponseInfo responseInfo = statusCode == null ? null : AuditEvent.ResponseInfo.builder()
                .statusCode(statusCode)
                .errorMessage(errorMessage)
                .build();

        logEventInternal(type, action, outcome, authInfo, requestInfo, responseInfo, data);
    }

    /**
     * Logs an event raised by the application itself, such as a scheduled retention run.
     * The principal is "system" unless an authenticated caller is in context.
     */
    public void logInternalEvent(
            String type,
            String action,
            Outcome outcome,
            @Nullable Map<String, Object> data) {

        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        AuditEvent.AuthInfo authInfo = isAuthenticated(authentication)
                ? AuditEvent.AuthInfo.builder()
                        .principal(authentication.getName())
                        .authorities(authorityNames(authentication))
                        .build()
                : AuditEvent.AuthInfo.builder().principal(AuditEvent.AuthInfo.SYSTEM).build();

        logEventInternal(type, action, outcome, authInfo, null, null, data);
    }

    private void logEventInternal(
            String type,
            String action,
            Outcome outcome,
            AuditEvent.AuthInfo authInfo,
            @Nullable AuditEvent.RequestInfo requestInfo,
            @Nullable AuditEvent.ResponseInfo responseInfo,
            @Nullable Map<String, Object> data) {
        try {
            AuditEvent auditEvent = AuditEvent.builder()
                    .timestamp(clock.instant())
                    .type(type)
                    .action(action)
                    .outcome(outcome)
                    .authInfo(authInfo)
                    .requestInfo(requestInfo)
                    .responseInfo(responseInfo)
                    .data(data != null && !data.isEmpty() ? data : null)
                    .build();

            auditBackend.logEvent(auditEvent);

        } catch (RuntimeException e) {
            // A broken audit trail must not fail the request it describes.
            log.error("Failed to log audit event: Type={}, Action={}, Outcome={}, Error={}",
                    type, action, outcome, e.getMessage(), e);
        }
    }

    @Nullable
    private HttpServletRequest getCurrentHttpRequest() {
        return Optional.ofNullable(RequestContextHolder.getRequestAttributes())
                .filter(ServletRequestAttributes.class::isInstance)
                .map(ServletRequestAttributes.class::cast)
                .map(ServletRequestAttributes::getRequest)
                .orElse(null);
    }

    private AuditEvent.AuthInfo buildAuthInfo(@Nullable Authentication authentication, @Nullable HttpServletRequest request) {
        AuditEvent.AuthInfo.AuthInfoBuilder builder = AuditEvent.AuthInfo.builder()
                .sourceAddress(request != null ? request.getRemoteAddr() : null);

        if (isAuthenticated(authentication)) {
            builder.principal(authentication.getName());
            builder.authorities(authorityNames(authentication));
        } else {
            builder.principal(AuditEvent.AuthInfo.ANONYMOUS);
        }
        return builder.build();
    }

    private static boolean isAuthenticated(@Nullable Authentication authentication) {
        return authentication != null
                && authentication.isAuthenticated()
                && !(authentication instanceof AnonymousAuthenticationToken);
    }

    private static List<String> authorityNames(Authentication authentication) {
        List<String> names = authentication.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .sorted()
                .toList();
        return names.isEmpty() ? null : names;
    }

    @Nullable
    private AuditEvent.RequestInfo buildRequestInfo(@Nullable HttpServletRequest request) {
        if (request == null) {
            return null;
        }
        return AuditEvent.RequestInfo.builder()
                .requestId((String) request.getAttribute(StaticTokenAuthFilter.REQUEST_ID_ATTR))
                .httpMethod(request.getMethod())
                .path(request.getRequestURI())
                .build();
    }
}
