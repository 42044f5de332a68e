package tech.yump.secretsync.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(description = "Configuration and last validation outcome of one store.")
public record StoreStatusResponse(
        @Schema(description = "Store scope.", example = "SECRET_STORE", requiredMode = Schema.RequiredMode.REQUIRED)
        String kind,
        @Schema(description = "Namespace of a namespaced store.", example = "team-a")
        String namespace,
        @Schema(description = "Store name.", example = "vault", requiredMode = Schema.RequiredMode.REQUIRED)
        String name,
        @Schema(description = "Provider variant.", example = "memory", requiredMode = Schema.RequiredMode.REQUIRED)
        String provider,
        @Schema(description = "Effective validation result; UNKNOWN when never checked or expired.", example = "READY", requiredMode = Schema.RequiredMode.REQUIRED)
        String result,
        @Schema(description = "When the store was last validated.")
        Instant checkedAt,
        @Schema(description = "Error of the last validation, if it failed.")
        String error
) {}
