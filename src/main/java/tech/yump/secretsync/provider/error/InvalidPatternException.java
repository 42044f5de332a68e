package tech.yump.secretsync.provider.error;

/**
 * A name filter expression failed to compile.
 */
public class InvalidPatternException extends SecretSyncException {

    public InvalidPatternException(String message) {
        super(ErrorKind.INVALID_PATTERN, message);
    }

    public InvalidPatternException(String message, Throwable cause) {
        super(ErrorKind.INVALID_PATTERN, message, cause);
    }
}
