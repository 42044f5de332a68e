package tech.yump.secretsync.provider.error;

/**
 * A reconcile pass exceeded its deadline. Already applied pushes are not rolled back.
 */
public class SyncTimeoutException extends SecretSyncException {

    public SyncTimeoutException(String message) {
        super(ErrorKind.TIMEOUT, message);
    }

    public SyncTimeoutException(String message, Throwable cause) {
        super(ErrorKind.TIMEOUT, message, cause);
    }
}
