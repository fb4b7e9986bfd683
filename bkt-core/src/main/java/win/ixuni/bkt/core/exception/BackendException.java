package win.ixuni.bkt.core.exception;

/**
 * 存储后端故障
 * <p>
 * 502 when the remote endpoint answered with an error, 500 for local failures.
 */
public class BackendException extends GatewayException {

    public BackendException(String message) {
        super("BackendError", message, 500);
    }

    public BackendException(String message, Throwable cause) {
        super("BackendError", message, 500, cause);
    }

    public BackendException(String message, int httpStatus, Throwable cause) {
        super("BackendError", message, httpStatus, cause);
    }
}
