package tech.yump.secretsync.provider.error;

/**
 * The requested secret (or version) does not exist in the backend.
 */
public class SecretNotFoundException extends SecretSyncException {

    public SecretNotFoundException(String message) {
        super(ErrorKind.SECRET_NOT_FOUND, message);
    }

    public SecretNotFoundException(String message, Throwable cause) {
        super(ErrorKind.SECRET_NOT_FOUND, message, cause);
    }
}
