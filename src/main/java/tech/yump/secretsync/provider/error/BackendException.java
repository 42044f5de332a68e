package tech.yump.secretsync.provider.error;

/**
 * Transient error returned by a backend call (network, throttling, server error).
 */
public class BackendException extends SecretSyncException {

    public BackendException(String message) {
        super(ErrorKind.BACKEND, message);
    }

    public BackendException(String message, Throwable cause) {
        super(ErrorKind.BACKEND, message, cause);
    }
}
