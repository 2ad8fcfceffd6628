package tech.yump.ledger.auth;

import org.springframework.security.core.GrantedAuthority;

/**
 * Authorities a static token can grant.
 */
public enum LedgerAuthority implements GrantedAuthority {
    /** Read events, verify the chain, read stats. */
    LEDGER_READ,
    /** Append events. */
    LEDGER_WRITE,
    /** Manage and run retention policies. */
    RETENTION_ADMIN;

    @Override
    public String getAuthority() {
        return name();
    }
}
