package tech.yump.secretsync.provider.error;

/**
 * A secret payload is not the JSON object the operation expects.
 */
public class MalformedPayloadException extends SecretSyncException {

    public MalformedPayloadException(String message) {
        super(ErrorKind.MALFORMED_PAYLOAD, message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(ErrorKind.MALFORMED_PAYLOAD, message, cause);
    }
}
