package tech.yump.secretsync.scheduler;

import org.springframework.lang.Nullable;
import tech.yump.secretsync.cluster.ObjectKey;
import tech.yump.secretsync.provider.error.ErrorKind;
import tech.yump.secretsync.store.StoreKey;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Point-in-time view of a definition's sync state.
 *
 * @param failures      consecutive failed passes
 * @param blockedBy     stores the flood gate is waiting for
 * @param syncedKeys    keys written by the last successful pass
 * @param pushedSecrets remote secrets written by the last successful pass
 */
public record SyncStatus(
        ObjectKey key,
        SyncPhase phase,
        @Nullable ErrorKind errorKind,
        @Nullable String errorMessage,
        int failures,
        @Nullable Instant lastSyncedAt,
        @Nullable Instant lastTransitionAt,
        Set<StoreKey> blockedBy,
        List<String> syncedKeys,
        List<String> pushedSecrets
) {}
