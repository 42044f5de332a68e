package tech.yump.secretsync.provider.error;

/**
 * A version token could not be parsed by the backend. Raised before any network call.
 */
public class InvalidVersionException extends SecretSyncException {

    public InvalidVersionException(String message) {
        super(ErrorKind.INVALID_VERSION, message);
    }

    public InvalidVersionException(String message, Throwable cause) {
        super(ErrorKind.INVALID_VERSION, message, cause);
    }
}
