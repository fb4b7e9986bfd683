package win.ixuni.bkt.core.exception;

/**
 * 资源仍被引用，无法删除或变更
 */
public class ResourceInUseException extends GatewayException {

    public ResourceInUseException(String message) {
        super("ResourceInUse", message, 409);
    }
}
