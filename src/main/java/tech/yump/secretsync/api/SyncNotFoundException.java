package tech.yump.secretsync.api;

import tech.yump.secretsync.cluster.ObjectKey;

/**
 * No sync definition exists under the requested key.
 */
public class SyncNotFoundException extends RuntimeException {

    public SyncNotFoundException(ObjectKey key) {
        super("Sync definition " + key + " not found");
    }
}
