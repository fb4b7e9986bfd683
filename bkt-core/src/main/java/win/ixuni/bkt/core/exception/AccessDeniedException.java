package win.ixuni.bkt.core.exception;

/**
 * Access denied by policy evaluation
 */
public class AccessDeniedException extends GatewayException {

    public AccessDeniedException(String message) {
        super("AccessDenied", message, 403);
    }

    public static AccessDeniedException forAction(String action, String resource) {
        return new AccessDeniedException("Access denied: " + action + " on " + resource);
    }
}
