package tech.yump.secretsync.scheduler;

/**
 * Lifecycle of one sync definition: {@code PENDING -> SYNCING -> SYNCED | FAILED -> PENDING}.
 */
public enum SyncPhase {
    PENDING,
    SYNCING,
    SYNCED,
    FAILED
}
