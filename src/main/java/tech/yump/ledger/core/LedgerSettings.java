package tech.yump.ledger.core;

/**
 * Construction-time settings of one ledger instance.
 *
 * @param name           label used in logs ("compliance", "audit").
 * @param enabled        when false the ledger builds events but never touches disk.
 * @param retentionYears default retention applied to events appended without an explicit one.
 */
public record LedgerSettings(String name, boolean enabled, int retentionYears) {

    public LedgerSettings {
        if (name == null || name.isBlank()) {
            name = "ledger";
        }
        if (retentionYears < 1) {
            throw new IllegalArgumentException("Retention years must be at least 1: " + retentionYears);
        }
    }
}
