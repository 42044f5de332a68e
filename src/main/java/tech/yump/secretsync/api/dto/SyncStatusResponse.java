package tech.yump.secretsync.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import tech.yump.secretsync.scheduler.SyncStatus;
import tech.yump.secretsync.store.StoreKey;

import java.time.Instant;
import java.util.List;

@Schema(description = "Current sync state of one definition. Lists key names only, never values.")
public record SyncStatusResponse(
        @Schema(description = "Namespace of the definition.", example = "team-a", requiredMode = Schema.RequiredMode.REQUIRED)
        String namespace,
        @Schema(description = "Name of the definition.", example = "db-credentials", requiredMode = Schema.RequiredMode.REQUIRED)
        String name,
        @Schema(description = "Lifecycle phase.", example = "SYNCED", requiredMode = Schema.RequiredMode.REQUIRED)
        String phase,
        @Schema(description = "Kind of the last error, if the last pass failed.", example = "BACKEND")
        String errorKind,
        @Schema(description = "Message of the last error.")
        String errorMessage,
        @Schema(description = "Consecutive failed passes.", example = "0")
        int failures,
        @Schema(description = "When the last successful pass completed.")
        Instant lastSyncedAt,
        @Schema(description = "When the phase last changed.")
        Instant lastTransitionAt,
        @Schema(description = "Stores the flood gate is waiting for.", example = "[\"team-a/vault\"]")
        List<String> blockedBy,
        @Schema(description = "Keys written to the target secret by the last successful pass.", example = "[\"password\", \"username\"]")
        List<String> syncedKeys,
        @Schema(description = "Remote secrets pushed by the last successful pass.")
        List<String> pushedSecrets
) {

    public static SyncStatusResponse from(SyncStatus status) {
        return new SyncStatusResponse(
                status.key().namespace(),
                status.key().name(),
                status.phase().name(),
                status.errorKind() == null ? null : status.errorKind().name(),
                status.errorMessage(),
                status.failures(),
                status.lastSyncedAt(),
                status.lastTransitionAt(),
                status.blockedBy().stream().map(StoreKey::toString).sorted().toList(),
                status.syncedKeys(),
                status.pushedSecrets());
    }
}
