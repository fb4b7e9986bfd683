package win.ixuni.bkt.core.exception;

import lombok.Getter;

/**
 * 多步操作中途失败
 * <p>
 * Carries the original failure as cause and the outcome of the single compensation attempt.
 */
@Getter
public class PartialFailureException extends GatewayException {

    private final boolean compensated;

    public PartialFailureException(String message, boolean compensated, Throwable cause) {
        super("PartialFailure", message + (compensated ? " (rolled back)" : " (rollback failed)"),
                500, cause);
        this.compensated = compensated;
    }
}
