package win.ixuni.bkt.core.exception;

public class UserNotFoundException extends GatewayException {

    public UserNotFoundException(String userRef) {
        super("NoSuchUser", "User not found: " + userRef, 404);
    }
}
