package win.ixuni.bkt.core.exception;

/**
 * 输入校验失败
 */
public class ValidationException extends GatewayException {

    public ValidationException(String message) {
        super("InvalidArgument", message, 400);
    }

    public ValidationException(String errorCode, String message) {
        super(errorCode, message, 400);
    }

    public static ValidationException invalidBucketName(String message) {
        return new ValidationException("InvalidBucketName", message);
    }

    public static ValidationException invalidKey(String message) {
        return new ValidationException("InvalidKey", message);
    }

    public static ValidationException malformedPolicy(String message) {
        return new ValidationException("MalformedPolicy", message);
    }
}
