package win.ixuni.bkt.core.exception;

import lombok.Getter;

/**
 * bkt 网关基础异常
 * <p>
 * Every failure surfaced to a client carries a category code and an HTTP status.
 */
@Getter
public class GatewayException extends RuntimeException {

    private final String errorCode;
    private final int httpStatus;

    public GatewayException(String errorCode, String message, int httpStatus) {
        super(message);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }

    public GatewayException(String errorCode, String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }
}
