package tech.yump.secretsync.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tech.yump.secretsync.cluster.ClusterSecretStore;
import tech.yump.secretsync.provider.error.ErrorKind;
import tech.yump.secretsync.sync.PushedRef;
import tech.yump.secretsync.sync.SecretSyncDefinition;
import tech.yump.secretsync.sync.SyncResult;

import java.time.Clock;
import java.util.List;

/**
 * Writes pulled data into the target cluster secret and logs a {@link SyncEvent} per pass.
 */
@Slf4j
@RequiredArgsConstructor
public class ClusterSecretSink implements SyncResultSink {

    private final ClusterSecretStore clusterSecretStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public void deliver(SyncOutcome outcome) {
        if (!outcome.isSuccess()) {
            logEvent(SyncEvent.builder()
                    .timestamp(outcome.completedAt())
                    .action("sync")
                    .outcome("failure")
                    .sync(outcome.key().toString())
                    .errorKind(outcome.errorKind() == null ? ErrorKind.INTERNAL.name() : outcome.errorKind().name())
                    .errorMessage(outcome.errorMessage())
                    .build());
            return;
        }

        SyncResult result = outcome.result();
        if (result.hasTarget()) {
            clusterSecretStore.put(result.target(), result.data());
        }
        logEvent(SyncEvent.builder()
                .timestamp(outcome.completedAt())
                .action("sync")
                .outcome("success")
                .sync(result.key().toString())
                .target(result.hasTarget() ? result.target().toString() : null)
                .keys(result.data().keySet().stream().sorted().toList())
                .pushed(result.pushed().stream().map(PushedRef::toString).sorted().toList())
                .build());
    }

    @Override
    public void removed(SecretSyncDefinition definition) {
        if (definition.pulls()) {
            clusterSecretStore.delete(definition.targetKey());
        }
        logEvent(SyncEvent.builder()
                .timestamp(clock.instant())
                .action("remove")
                .outcome("success")
                .sync(definition.key().toString())
                .target(definition.pulls() ? definition.targetKey().toString() : null)
                .keys(List.of())
                .build());
    }

    private void logEvent(SyncEvent event) {
        try {
            log.info("SYNC_EVENT: {}", objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize SyncEvent to JSON. Logging raw event details.", e);
            log.info("SYNC_EVENT_FALLBACK: {}", event);
        }
    }
}
