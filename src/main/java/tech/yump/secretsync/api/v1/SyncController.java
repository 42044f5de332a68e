package tech.yump.secretsync.api.v1;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.secretsync.api.ApiError;
import tech.yump.secretsync.api.SyncNotFoundException;
import tech.yump.secretsync.api.dto.SyncStatusResponse;
import tech.yump.secretsync.cluster.ObjectKey;
import tech.yump.secretsync.scheduler.ReconciliationScheduler;
import tech.yump.secretsync.sync.SecretSyncDefinition;

import java.util.List;

@RestController
@RequestMapping("/v1/syncs")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "Syncs", description = "Status and control of secret sync definitions")
public class SyncController {

    private final ReconciliationScheduler scheduler;

    @GetMapping
    @Operation(summary = "List syncs", description = "Returns the sync state of every definition.")
    @ApiResponse(responseCode = "200", description = "Sync states retrieved.",
            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                    array = @ArraySchema(schema = @Schema(implementation = SyncStatusResponse.class))))
    public List<SyncStatusResponse> listSyncs() {
        return scheduler.statuses().stream().map(SyncStatusResponse::from).toList();
    }

    @GetMapping("/{namespace}/{name}")
    @Operation(summary = "Get sync status", description = "Returns the sync state of one definition.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Sync state retrieved.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = SyncStatusResponse.class))),
            @ApiResponse(responseCode = "404", description = "No such sync definition.",
                    content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public SyncStatusResponse getSync(
            @Parameter(description = "Namespace of the definition.", example = "team-a") @PathVariable String namespace,
            @Parameter(description = "Name of the definition.", example = "db-credentials") @PathVariable String name) {
        ObjectKey key = ObjectKey.of(namespace, name);
        return scheduler.status(key).map(SyncStatusResponse::from).orElseThrow(() -> new SyncNotFoundException(key));
    }

    @PutMapping("/{namespace}/{name}")
    @Operation(summary = "Apply sync definition",
            description = "Creates or replaces a definition and schedules a pass right away. Path and body must name the same definition.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Definition applied, pass scheduled."),
            @ApiResponse(responseCode = "400", description = "Invalid definition.",
                    content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<Void> applySync(
            @PathVariable String namespace,
            @PathVariable String name,
            @Valid @RequestBody SecretSyncDefinition definition) {
        if (!namespace.equals(definition.namespace()) || !name.equals(definition.name())) {
            throw new IllegalArgumentException("Definition " + definition.key() + " does not match path " + namespace + "/" + name);
        }
        scheduler.apply(definition);
        log.info("Applied sync definition {} through API", definition.key());
        return ResponseEntity.accepted().build();
    }

    @DeleteMapping("/{namespace}/{name}")
    @Operation(summary = "Remove sync definition",
            description = "Removes a definition. Pushed secrets are deleted from their backends when its deletion policy is DELETE.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Definition removed, cleanup scheduled."),
            @ApiResponse(responseCode = "404", description = "No such sync definition.",
                    content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<Void> removeSync(@PathVariable String namespace, @PathVariable String name) {
        ObjectKey key = ObjectKey.of(namespace, name);
        if (!scheduler.remove(key)) {
            throw new SyncNotFoundException(key);
        }
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/{namespace}/{name}/trigger")
    @Operation(summary = "Trigger sync", description = "Schedules an immediate pass, also for definitions that failed permanently.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Pass scheduled."),
            @ApiResponse(responseCode = "404", description = "No such sync definition.",
                    content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<Void> triggerSync(@PathVariable String namespace, @PathVariable String name) {
        ObjectKey key = ObjectKey.of(namespace, name);
        if (!scheduler.trigger(key)) {
            throw new SyncNotFoundException(key);
        }
        log.info("Triggered sync {} through API", key);
        return ResponseEntity.accepted().build();
    }
}
