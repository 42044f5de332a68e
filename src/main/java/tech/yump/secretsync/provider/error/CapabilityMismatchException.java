package tech.yump.secretsync.provider.error;

/**
 * A read was attempted against a write-only store, or a push against a read-only one.
 */
public class CapabilityMismatchException extends SecretSyncException {

    public CapabilityMismatchException(String message) {
        super(ErrorKind.CAPABILITY_MISMATCH, message);
    }

    public CapabilityMismatchException(String message, Throwable cause) {
        super(ErrorKind.CAPABILITY_MISMATCH, message, cause);
    }
}
