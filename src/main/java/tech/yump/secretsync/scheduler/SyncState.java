package tech.yump.secretsync.scheduler;

import org.springframework.lang.Nullable;
import tech.yump.secretsync.cluster.ObjectKey;
import tech.yump.secretsync.provider.error.ErrorKind;
import tech.yump.secretsync.store.StoreKey;
import tech.yump.secretsync.sync.PushedRef;
import tech.yump.secretsync.sync.SecretSyncDefinition;
import tech.yump.secretsync.sync.SyncResult;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Mutable per-definition state owned by the scheduler. Worker threads and status readers go
 * through the synchronized methods.
 */
class SyncState {

    private final ObjectKey key;
    private SyncPhase phase = SyncPhase.PENDING;
    private ErrorKind errorKind;
    private String errorMessage;
    private int failures;
    private Instant lastSyncedAt;
    private Instant lastTransitionAt;
    private Set<StoreKey> blockedBy = Set.of();
    private List<String> syncedKeys = List.of();
    private Set<PushedRef> pushed = Set.of();
    private SecretSyncDefinition removedDefinition;

    SyncState(ObjectKey key) {
        this.key = key;
    }

    synchronized void toPending(Instant now) {
        transition(SyncPhase.PENDING, now);
    }

    synchronized void gate(Set<StoreKey> stores, Instant now) {
        transition(SyncPhase.PENDING, now);
        blockedBy = Set.copyOf(stores);
    }

    synchronized void toSyncing(Instant now) {
        blockedBy = Set.of();
        transition(SyncPhase.SYNCING, now);
    }

    synchronized void toSynced(SyncResult result, Instant now) {
        transition(SyncPhase.SYNCED, now);
        errorKind = null;
        errorMessage = null;
        failures = 0;
        lastSyncedAt = now;
        syncedKeys = result.data().keySet().stream().sorted().toList();
        pushed = result.pushed();
    }

    /**
     * @return consecutive failures including this one
     */
    synchronized int toFailed(ErrorKind kind, String message, Instant now) {
        transition(SyncPhase.FAILED, now);
        errorKind = kind;
        errorMessage = message;
        return ++failures;
    }

    synchronized void resetFailures() {
        failures = 0;
    }

    synchronized Set<PushedRef> pushed() {
        return pushed;
    }

    synchronized void markRemoved(SecretSyncDefinition definition) {
        removedDefinition = definition;
    }

    synchronized void clearRemoved() {
        removedDefinition = null;
    }

    @Nullable
    synchronized SecretSyncDefinition removedDefinition() {
        return removedDefinition;
    }

    synchronized SyncPhase phase() {
        return phase;
    }

    synchronized SyncStatus snapshot() {
        return new SyncStatus(key, phase, errorKind, errorMessage, failures, lastSyncedAt, lastTransitionAt,
                blockedBy, syncedKeys, pushed.stream().map(PushedRef::toString).sorted().toList());
    }

    private void transition(SyncPhase next, Instant now) {
        if (phase != next) {
            lastTransitionAt = now;
        }
        phase = next;
    }
}
