package win.ixuni.bkt.core.exception;

public class EntityTooLargeException extends GatewayException {

    public EntityTooLargeException(long size, long maxSize) {
        super("EntityTooLarge",
                "Your proposed upload exceeds the maximum allowed size: " + size + " > " + maxSize, 413);
    }
}
