package tech.yump.secretsync.api.v1;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.secretsync.api.dto.StoreStatusResponse;
import tech.yump.secretsync.scheduler.StoreHealthCache;
import tech.yump.secretsync.scheduler.StoreHealthChecker;
import tech.yump.secretsync.store.SecretStoreDefinition;
import tech.yump.secretsync.store.StoreKey;
import tech.yump.secretsync.store.StoreRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/v1/stores")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "Stores", description = "Configured stores and their health")
public class StoreController {

    private final StoreRepository storeRepository;
    private final StoreHealthCache healthCache;
    private final StoreHealthChecker healthChecker;

    @GetMapping
    @Operation(summary = "List stores", description = "Returns every configured store with its last validation outcome.")
    @ApiResponse(responseCode = "200", description = "Stores retrieved.",
            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                    array = @ArraySchema(schema = @Schema(implementation = StoreStatusResponse.class))))
    public List<StoreStatusResponse> listStores() {
        return storeRepository.all().stream()
                .sorted(Comparator.comparing(store -> store.key().toString()))
                .map(this::toResponse)
                .toList();
    }

    @PostMapping("/validate")
    @Operation(summary = "Validate stores", description = "Validates every configured store now and returns the outcomes.")
    @ApiResponse(responseCode = "200", description = "Stores validated.",
            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                    array = @ArraySchema(schema = @Schema(implementation = StoreStatusResponse.class))))
    public List<StoreStatusResponse> validateStores() {
        log.info("Validating all stores on request");
        healthChecker.probeAll();
        return listStores();
    }

    private StoreStatusResponse toResponse(SecretStoreDefinition store) {
        StoreKey key = store.key();
        Optional<StoreHealthCache.Entry> entry = healthCache.entry(key);
        return new StoreStatusResponse(
                key.kind().name(),
                key.namespace(),
                key.name(),
                String.join(",", store.provider().configuredVariants()),
                healthCache.resultOf(key).name(),
                entry.map(StoreHealthCache.Entry::checkedAt).orElse(null),
                entry.map(e -> e.status().error()).map(Throwable::getMessage).orElse(null));
    }
}
