package win.ixuni.bkt.core.policy;

public enum PolicyDecision {
    ALLOW,
    DENY;

    public boolean isAllowed() {
        return this == ALLOW;
    }
}
