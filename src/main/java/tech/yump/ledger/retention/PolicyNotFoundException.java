package tech.yump.ledger.retention;

public class PolicyNotFoundException extends RuntimeException {

    private final String policyId;

    public PolicyNotFoundException(String policyId) {
        super("Retention policy not found: " + policyId);
        this.policyId = policyId;
    }

    public String getPolicyId() {
        return policyId;
    }
}
