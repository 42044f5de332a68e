package tech.yump.secretsync.sink;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Structured record of what a pass did, logged as JSON. Carries key names only, never values.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncEvent(
        Instant timestamp,
        String action,          // "sync" or "remove"
        String outcome,         // "success" or "failure"
        String sync,            // namespace/name of the definition
        String target,          // namespace/name of the written cluster secret
        List<String> keys,
        List<String> pushed,
        String errorKind,
        String errorMessage
) {}
