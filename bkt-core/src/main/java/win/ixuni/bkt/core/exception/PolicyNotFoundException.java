package win.ixuni.bkt.core.exception;

public class PolicyNotFoundException extends GatewayException {

    public PolicyNotFoundException(String policyRef) {
        super("NoSuchPolicy", "Policy not found: " + policyRef, 404);
    }
}
