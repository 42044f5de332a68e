package tech.yump.secretsync.sink;

import tech.yump.secretsync.sync.SecretSyncDefinition;

/**
 * Downstream consumer of sync passes.
 */
public interface SyncResultSink {

    /**
     * Called once per completed pass, successful or not. A failure thrown from here fails the pass.
     */
    void deliver(SyncOutcome outcome);

    /**
     * Called after a removed definition has been cleaned up.
     */
    void removed(SecretSyncDefinition definition);
}
