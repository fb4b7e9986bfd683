package win.ixuni.bkt.core.upload;

/**
 * Receives byte counts from a {@link ProgressTrackingChannel}
 * <p>
 * Called on the reading thread; implementations hand persistence off to another scheduler.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(long bytesRead);
}
