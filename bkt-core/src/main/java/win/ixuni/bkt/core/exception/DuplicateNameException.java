package win.ixuni.bkt.core.exception;

/**
 * Unique name already taken (policy, S3 configuration, ...)
 */
public class DuplicateNameException extends GatewayException {

    public DuplicateNameException(String kind, String name) {
        super("EntityAlreadyExists", kind + " with name '" + name + "' already exists", 409);
    }
}
