package tech.yump.secretsync.backend.local;

import tech.yump.secretsync.provider.error.BackendException;

/**
 * I/O failure of the local vault's file storage.
 */
public class StorageException extends BackendException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
