package tech.yump.secretsync.api;

import io.swagger.v3.oas.annotations.media.Schema;

import java.net.URI;

@Schema(description = "RFC 7807 problem response returned for every error.")
public record ApiError(
        @Schema(description = "Short summary of the problem.", example = "Sync Not Found", requiredMode = Schema.RequiredMode.REQUIRED)
        String title,
        @Schema(description = "HTTP status code.", example = "404", requiredMode = Schema.RequiredMode.REQUIRED)
        int status,
        @Schema(description = "Detailed error message.", example = "Sync definition team-a/db-credentials not found")
        String detail,
        @Schema(description = "Request path.", example = "/v1/syncs/team-a/db-credentials")
        URI instance
) {}
