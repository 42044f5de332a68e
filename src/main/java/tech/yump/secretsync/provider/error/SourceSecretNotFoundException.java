package tech.yump.secretsync.provider.error;

/**
 * The cluster secret a push reads from does not exist (yet).
 */
public class SourceSecretNotFoundException extends SecretSyncException {

    public SourceSecretNotFoundException(String message) {
        super(ErrorKind.SOURCE_SECRET_NOT_FOUND, message);
    }

    public SourceSecretNotFoundException(String message, Throwable cause) {
        super(ErrorKind.SOURCE_SECRET_NOT_FOUND, message, cause);
    }
}
