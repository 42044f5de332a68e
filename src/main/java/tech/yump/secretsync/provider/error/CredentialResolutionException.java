package tech.yump.secretsync.provider.error;

/**
 * A referenced credential is missing or not accessible from the requesting scope.
 */
public class CredentialResolutionException extends SecretSyncException {

    public CredentialResolutionException(String message) {
        super(ErrorKind.CREDENTIAL_RESOLUTION, message);
    }

    public CredentialResolutionException(String message, Throwable cause) {
        super(ErrorKind.CREDENTIAL_RESOLUTION, message, cause);
    }
}
