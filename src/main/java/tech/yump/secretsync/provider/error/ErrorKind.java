package tech.yump.secretsync.provider.error;

/**
 * Classification of sync failures. The scheduler only looks at {@link #isRetryable()}
 * to decide between backoff and waiting for a configuration change.
 */
public enum ErrorKind {
    CONFIGURATION(false),
    CREDENTIAL_RESOLUTION(true),
    BACKEND_CONNECT(true),
    BACKEND(true),
    SECRET_NOT_FOUND(true),
    INVALID_VERSION(false),
    INVALID_PATTERN(false),
    MALFORMED_PAYLOAD(false),
    PROPERTY_NOT_FOUND(false),
    SOURCE_KEY_NOT_FOUND(false),
    SOURCE_SECRET_NOT_FOUND(true),
    CAPABILITY_MISMATCH(false),
    TIMEOUT(true),
    INTERNAL(true);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Returns the kind carried by a {@link SecretSyncException}, or {@link #INTERNAL} for anything else.
     */
    public static ErrorKind of(Throwable error) {
        if (error instanceof SecretSyncException syncException) {
            return syncException.getKind();
        }
        return INTERNAL;
    }
}
