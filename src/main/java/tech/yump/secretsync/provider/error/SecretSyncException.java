package tech.yump.secretsync.provider.error;

/**
 * Base exception for every failure raised by providers, clients and the sync pass.
 */
public class SecretSyncException extends RuntimeException {

    private final ErrorKind kind;

    public SecretSyncException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SecretSyncException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
