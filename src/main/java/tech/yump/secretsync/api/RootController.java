package tech.yump.secretsync.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.secretsync.provider.ProviderRegistry;

import java.util.Map;
import java.util.TreeSet;

@RestController
@RequiredArgsConstructor
@Tag(name = "System", description = "System information and status endpoints")
public class RootController {

    private final ProviderRegistry providerRegistry;

    @GetMapping("/")
    @Operation(
            summary = "Root Endpoint",
            description = "Provides a welcome message, a status check and the registered provider variants."
    )
    @ApiResponse(responseCode = "200", description = "Welcome message and status.",
            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                    schema = @Schema(type = "object", example = "{\"message\": \"Welcome to Lite Secret Sync API\", \"status\": \"OK\", \"providers\": [\"aws\", \"local\", \"memory\"]}")))
    public Map<String, Object> getRoot() {
        return Map.of(
                "message", "Welcome to Lite Secret Sync API",
                "status", "OK",
                "providers", new TreeSet<>(providerRegistry.tags()));
    }
}
