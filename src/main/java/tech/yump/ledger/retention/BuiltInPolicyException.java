package tech.yump.ledger.retention;

/**
 * Thrown when a caller tries to change or remove one of the {@link BuiltInPolicies}.
 */
public class BuiltInPolicyException extends RuntimeException {

    private final String policyId;

    public BuiltInPolicyException(String policyId) {
        super("Built-in retention policy cannot be modified: " + policyId);
        this.policyId = policyId;
    }

    public String getPolicyId() {
        return policyId;
    }
}
