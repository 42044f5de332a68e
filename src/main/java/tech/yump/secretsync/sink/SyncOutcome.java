package tech.yump.secretsync.sink;

import org.springframework.lang.Nullable;
import tech.yump.secretsync.cluster.ObjectKey;
import tech.yump.secretsync.provider.error.ErrorKind;
import tech.yump.secretsync.sync.SyncResult;

import java.time.Instant;

/**
 * What one completed pass hands downstream: the result, or the error that failed it.
 */
public record SyncOutcome(
        ObjectKey key,
        @Nullable SyncResult result,
        @Nullable ErrorKind errorKind,
        @Nullable String errorMessage,
        Instant completedAt
) {

    public static SyncOutcome success(SyncResult result, Instant completedAt) {
        return new SyncOutcome(result.key(), result, null, null, completedAt);
    }

    public static SyncOutcome failure(ObjectKey key, ErrorKind kind, String message, Instant completedAt) {
        return new SyncOutcome(key, null, kind, message, completedAt);
    }

    public boolean isSuccess() {
        return result != null;
    }
}
