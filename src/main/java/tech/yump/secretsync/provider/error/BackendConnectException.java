package tech.yump.secretsync.provider.error;

/**
 * The authenticated handshake with a backend failed.
 */
public class BackendConnectException extends SecretSyncException {

    public BackendConnectException(String message) {
        super(ErrorKind.BACKEND_CONNECT, message);
    }

    public BackendConnectException(String message, Throwable cause) {
        super(ErrorKind.BACKEND_CONNECT, message, cause);
    }
}
