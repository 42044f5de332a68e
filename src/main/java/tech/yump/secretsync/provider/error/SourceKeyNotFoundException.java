package tech.yump.secretsync.provider.error;

/**
 * The push source key is absent from the source secret data.
 */
public class SourceKeyNotFoundException extends SecretSyncException {

    public SourceKeyNotFoundException(String message) {
        super(ErrorKind.SOURCE_KEY_NOT_FOUND, message);
    }

    public SourceKeyNotFoundException(String message, Throwable cause) {
        super(ErrorKind.SOURCE_KEY_NOT_FOUND, message, cause);
    }
}
