package tech.yump.secretsync.provider.error;

public class PropertyNotFoundException extends SecretSyncException {

    public PropertyNotFoundException(String message) {
        super(ErrorKind.PROPERTY_NOT_FOUND, message);
    }

    public PropertyNotFoundException(String message, Throwable cause) {
        super(ErrorKind.PROPERTY_NOT_FOUND, message, cause);
    }
}
