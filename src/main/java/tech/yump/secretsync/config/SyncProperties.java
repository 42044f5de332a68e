package tech.yump.secretsync.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.lang.Nullable;
import org.springframework.validation.annotation.Validated;
import tech.yump.secretsync.cluster.ObjectKey;
import tech.yump.secretsync.scheduler.SchedulerSettings;
import tech.yump.secretsync.store.SecretStoreDefinition;
import tech.yump.secretsync.sync.SecretSyncDefinition;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Configuration properties of the secret sync application under the 'sync' prefix.
 */
@ConfigurationProperties(prefix = "sync")
@Validated
public record SyncProperties(

        @Valid
        SchedulerSettings scheduler,

        @Valid
        HealthProperties health,

        @Valid
        List<SecretStoreDefinition> stores,

        @Valid
        List<SecretSyncDefinition> syncs,

        @Valid
        List<ClusterSecretSeed> clusterSecrets,

        @Valid
        List<MemoryVaultSeed> memoryVaults
) {

    public SyncProperties {
        scheduler = scheduler == null ? SchedulerSettings.defaults() : scheduler;
        health = health == null ? new HealthProperties(null, null) : health;
        stores = stores == null ? List.of() : List.copyOf(stores);
        syncs = syncs == null ? List.of() : List.copyOf(syncs);
        clusterSecrets = clusterSecrets == null ? List.of() : List.copyOf(clusterSecrets);
        memoryVaults = memoryVaults == null ? List.of() : List.copyOf(memoryVaults);
    }

    @AssertTrue(message = "Store definitions (sync.stores) must be unique per kind, namespace and name.")
    public boolean isStoreKeysUnique() {
        return allUnique(stores, SecretStoreDefinition::key);
    }

    @AssertTrue(message = "Sync definitions (sync.syncs) must be unique per namespace and name.")
    public boolean isSyncKeysUnique() {
        return allUnique(syncs, sync -> sync.namespace() + "/" + sync.name());
    }

    @AssertTrue(message = "Memory vault ids (sync.memory-vaults) must be unique.")
    public boolean isMemoryVaultIdsUnique() {
        return allUnique(memoryVaults, MemoryVaultSeed::id);
    }

    private static <T, K> boolean allUnique(List<T> items, Function<T, K> keyOf) {
        Set<K> seen = new HashSet<>();
        return items.stream()
                .filter(Objects::nonNull)
                .map(keyOf)
                .allMatch(seen::add);
    }

    // --- HealthProperties ---
    @Validated
    public record HealthProperties(
            Duration checkInterval,
            Duration ttl
    ) {
        public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofSeconds(30);
        public static final Duration DEFAULT_TTL = Duration.ofMinutes(2);

        public HealthProperties {
            checkInterval = checkInterval == null ? DEFAULT_CHECK_INTERVAL : checkInterval;
            ttl = ttl == null ? DEFAULT_TTL : ttl;
        }

        @AssertTrue(message = "Store health check interval and TTL (sync.health) must be positive, and the TTL must not be shorter than the interval.")
        public boolean isIntervalsValid() {
            return !checkInterval.isNegative() && !checkInterval.isZero() && ttl.compareTo(checkInterval) >= 0;
        }
    }

    // --- ClusterSecretSeed ---
    /**
     * A cluster secret created at startup, typically holding backend credentials.
     */
    @Validated
    public record ClusterSecretSeed(
            @NotBlank(message = "Cluster secret namespace must be provided.")
            String namespace,
            @NotBlank(message = "Cluster secret name must be provided.")
            String name,
            @NotNull(message = "Cluster secret data must be provided.")
            Map<String, String> data
    ) {
        public ObjectKey key() {
            return ObjectKey.of(namespace, name);
        }
    }

    // --- MemoryVaultSeed ---
    /**
     * A vault of the memory backend created at startup.
     *
     * @param authToken token clients must present, or none for an open vault
     * @param secrets   initial plaintext values by secret name
     */
    @Validated
    public record MemoryVaultSeed(
            @NotBlank(message = "Memory vault id must be provided.")
            String id,
            @Nullable String authToken,
            Map<String, String> secrets
    ) {
        public MemoryVaultSeed {
            secrets = secrets == null ? Map.of() : Map.copyOf(secrets);
        }
    }
}
