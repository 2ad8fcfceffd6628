package tech.yump.ledger.api.v1;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import tech.yump.ledger.auth.LedgerAuthority;
import tech.yump.ledger.event.Actor;

/**
 * Maps the authenticated caller of the current request to a ledger {@link Actor}.
 */
final class CallerActors {

    static final String ANONYMOUS_ID = "anonymous";

    private CallerActors() {
    }

    static Actor current(HttpServletRequest request) {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()
                || authentication instanceof AnonymousAuthenticationToken) {
            return Actor.user(ANONYMOUS_ID, request.getRemoteAddr());
        }
        boolean admin = authentication.getAuthorities().stream()
                .anyMatch(a -> LedgerAuthority.RETENTION_ADMIN.getAuthority().equals(a.getAuthority()));
        Actor.Type type = admin ? Actor.Type.ADMIN : Actor.Type.USER;
        return new Actor(type, authentication.getName(), request.getRemoteAddr());
    }
}
