package tech.yump.secretsync.provider.error;

/**
 * A required configuration field is missing or invalid. Never retried until the configuration changes.
 */
public class ConfigurationException extends SecretSyncException {

    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorKind.CONFIGURATION, message, cause);
    }
}
