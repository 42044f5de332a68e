package tech.yump.secretsync.sync;

import tech.yump.secretsync.store.StoreKey;

/**
 * A remote secret written by a sync pass, remembered so it can be deleted later.
 */
public record PushedRef(StoreKey store, String remoteKey) {

    @Override
    public String toString() {
        return store + ":" + remoteKey;
    }
}
