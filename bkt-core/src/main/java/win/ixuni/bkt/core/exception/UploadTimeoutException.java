package win.ixuni.bkt.core.exception;

import java.time.Duration;

/**
 * 同步上传等待超时
 * <p>
 * The background write keeps running; its outcome is only visible in persisted state.
 */
public class UploadTimeoutException extends GatewayException {

    public UploadTimeoutException(String bucketName, String key, Duration timeout) {
        super("RequestTimeout", "Upload of " + bucketName + "/" + key + " did not finish within "
                + timeout.toSeconds() + "s; it continues in the background", 408);
    }
}
