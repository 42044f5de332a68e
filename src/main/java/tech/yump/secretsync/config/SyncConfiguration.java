package tech.yump.secretsync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.secretsync.backend.aws.AwsSecretsManagerProvider;
import tech.yump.secretsync.backend.local.LocalVaultProvider;
import tech.yump.secretsync.backend.memory.InMemorySecretVault;
import tech.yump.secretsync.backend.memory.MemoryProvider;
import tech.yump.secretsync.cluster.ClusterCredentialResolver;
import tech.yump.secretsync.cluster.ClusterSecretStore;
import tech.yump.secretsync.cluster.InMemoryClusterSecretStore;
import tech.yump.secretsync.provider.CredentialResolver;
import tech.yump.secretsync.provider.DataExtractor;
import tech.yump.secretsync.provider.Provider;
import tech.yump.secretsync.provider.ProviderRegistry;
import tech.yump.secretsync.scheduler.ReconciliationScheduler;
import tech.yump.secretsync.scheduler.StoreHealthCache;
import tech.yump.secretsync.scheduler.StoreHealthChecker;
import tech.yump.secretsync.sink.ClusterSecretSink;
import tech.yump.secretsync.sink.SyncResultSink;
import tech.yump.secretsync.store.StoreRepository;
import tech.yump.secretsync.sync.SecretSyncer;
import tech.yump.secretsync.sync.SyncDefinitionRepository;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class SyncConfiguration {

    private final SyncProperties syncProperties;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DataExtractor dataExtractor(ObjectMapper objectMapper) {
        return new DataExtractor(objectMapper);
    }

    // --- Providers ---

    @Bean
    public MemoryProvider memoryProvider(DataExtractor dataExtractor) {
        MemoryProvider provider = new MemoryProvider(dataExtractor);
        for (SyncProperties.MemoryVaultSeed seed : syncProperties.memoryVaults()) {
            InMemorySecretVault vault = provider.createVault(seed.id(), seed.authToken());
            seed.secrets().forEach((name, value) -> vault.write(name, value.getBytes(StandardCharsets.UTF_8)));
            log.info("Seeded memory vault '{}' with {} secrets", seed.id(), seed.secrets().size());
        }
        return provider;
    }

    @Bean
    public LocalVaultProvider localVaultProvider(ObjectMapper objectMapper, DataExtractor dataExtractor, Clock clock) {
        return new LocalVaultProvider(objectMapper, dataExtractor, clock);
    }

    @Bean
    public AwsSecretsManagerProvider awsSecretsManagerProvider(DataExtractor dataExtractor) {
        return new AwsSecretsManagerProvider(dataExtractor);
    }

    @Bean
    public ProviderRegistry providerRegistry(List<Provider> providers) {
        ProviderRegistry.Builder builder = ProviderRegistry.builder();
        providers.forEach(provider -> builder.register(provider.variantTag(), provider, provider.maintenanceStatus()));
        ProviderRegistry registry = builder.build();
        log.info("Provider registry initialized with variants {}", registry.tags());
        return registry;
    }

    // --- Cluster state ---

    @Bean
    public ClusterSecretStore clusterSecretStore() {
        InMemoryClusterSecretStore store = new InMemoryClusterSecretStore();
        for (SyncProperties.ClusterSecretSeed seed : syncProperties.clusterSecrets()) {
            Map<String, byte[]> data = new HashMap<>();
            seed.data().forEach((key, value) -> data.put(key, value.getBytes(StandardCharsets.UTF_8)));
            store.put(seed.key(), data);
        }
        log.info("Cluster secret store seeded with {} secrets", syncProperties.clusterSecrets().size());
        return store;
    }

    @Bean
    public CredentialResolver credentialResolver(ClusterSecretStore clusterSecretStore) {
        return new ClusterCredentialResolver(clusterSecretStore);
    }

    @Bean
    public StoreRepository storeRepository() {
        return new StoreRepository(syncProperties.stores());
    }

    @Bean
    public SyncDefinitionRepository syncDefinitionRepository() {
        SyncDefinitionRepository repository = new SyncDefinitionRepository();
        syncProperties.syncs().forEach(repository::put);
        log.info("Loaded {} sync definitions from configuration", syncProperties.syncs().size());
        return repository;
    }

    // --- Sync engine ---

    @Bean
    public SecretSyncer secretSyncer(ProviderRegistry providerRegistry, StoreRepository storeRepository,
                                     CredentialResolver credentialResolver, ClusterSecretStore clusterSecretStore) {
        return new SecretSyncer(providerRegistry, storeRepository, credentialResolver, clusterSecretStore);
    }

    @Bean
    public SyncResultSink syncResultSink(ClusterSecretStore clusterSecretStore, ObjectMapper objectMapper, Clock clock) {
        return new ClusterSecretSink(clusterSecretStore, objectMapper, clock);
    }

    @Bean
    public StoreHealthCache storeHealthCache(Clock clock) {
        return new StoreHealthCache(clock, syncProperties.health().ttl());
    }

    @Bean
    public StoreHealthChecker storeHealthChecker(ProviderRegistry providerRegistry, StoreRepository storeRepository,
                                                 CredentialResolver credentialResolver, StoreHealthCache storeHealthCache) {
        return new StoreHealthChecker(providerRegistry, storeRepository, credentialResolver, storeHealthCache,
                syncProperties.health().checkInterval());
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public ReconciliationScheduler reconciliationScheduler(SyncDefinitionRepository syncDefinitionRepository,
                                                           SecretSyncer secretSyncer, SyncResultSink syncResultSink,
                                                           StoreHealthCache storeHealthCache,
                                                           StoreHealthChecker storeHealthChecker, Clock clock) {
        log.info("Configuring reconciliation scheduler: {}", syncProperties.scheduler());
        return new ReconciliationScheduler(syncDefinitionRepository, secretSyncer, syncResultSink, storeHealthCache,
                storeHealthChecker, syncProperties.scheduler(), clock);
    }
}
