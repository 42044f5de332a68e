package tech.yump.secretsync.scheduler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import tech.yump.secretsync.provider.CredentialResolver;
import tech.yump.secretsync.provider.Provider;
import tech.yump.secretsync.provider.ProviderRegistry;
import tech.yump.secretsync.provider.SecretsClient;
import tech.yump.secretsync.provider.ValidationResult;
import tech.yump.secretsync.provider.ValidationStatus;
import tech.yump.secretsync.provider.error.BackendException;
import tech.yump.secretsync.provider.error.ConfigurationException;
import tech.yump.secretsync.provider.error.SecretSyncException;
import tech.yump.secretsync.store.SecretStoreDefinition;
import tech.yump.secretsync.store.StoreKey;
import tech.yump.secretsync.store.StoreRepository;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Validates stores periodically and on request, feeding {@link StoreHealthCache}. Each probe builds
 * a client, calls {@link SecretsClient#validate()} and closes it again.
 */
@Slf4j
public class StoreHealthChecker {

    /**
     * Notified when the effective result of a store changes.
     */
    @FunctionalInterface
    public interface Listener {
        void onHealthChange(StoreKey store, ValidationResult previous, ValidationResult current);
    }

    private final ProviderRegistry providerRegistry;
    private final StoreRepository storeRepository;
    private final CredentialResolver credentialResolver;
    private final StoreHealthCache healthCache;
    private final Duration checkInterval;
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    private final Set<StoreKey> pendingProbes = ConcurrentHashMap.newKeySet();
    private ScheduledExecutorService executor;

    public StoreHealthChecker(ProviderRegistry providerRegistry, StoreRepository storeRepository,
                              CredentialResolver credentialResolver, StoreHealthCache healthCache, Duration checkInterval) {
        this.providerRegistry = providerRegistry;
        this.storeRepository = storeRepository;
        this.credentialResolver = credentialResolver;
        this.healthCache = healthCache;
        this.checkInterval = checkInterval;
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("store-health-"));
        executor.scheduleWithFixedDelay(this::probeAllSafely, 0, checkInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Store health checker started, interval {}", checkInterval);
    }

    public synchronized void stop() {
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
            log.info("Store health checker stopped");
        }
    }

    public void addListener(Listener listener) {
        listeners.add(listener);
    }

    /**
     * Schedules an asynchronous probe unless one is already pending for the store.
     */
    public void requestProbe(StoreKey store) {
        ScheduledExecutorService current;
        synchronized (this) {
            current = executor;
        }
        if (current == null || !pendingProbes.add(store)) {
            return;
        }
        try {
            current.execute(() -> {
                try {
                    probe(store);
                } finally {
                    pendingProbes.remove(store);
                }
            });
        } catch (RejectedExecutionException e) {
            pendingProbes.remove(store);
            log.debug("Probe of store {} rejected, checker is stopping", store);
        }
    }

    /**
     * Validates every configured store now.
     */
    public void probeAll() {
        for (SecretStoreDefinition store : storeRepository.all()) {
            probe(store.key());
        }
    }

    /**
     * Validates one store synchronously and records the outcome.
     */
    public ValidationStatus probe(StoreKey storeKey) {
        ValidationStatus status = validate(storeKey);
        ValidationResult previous = healthCache.resultOf(storeKey);
        healthCache.record(storeKey, status);

        if (previous != status.result()) {
            if (status.isReady()) {
                log.info("Store {} is ready (was {})", storeKey, previous);
            } else {
                log.warn("Store {} is {} (was {}): {}", storeKey, status.result(), previous,
                        status.error() != null ? status.error().getMessage() : "no details");
            }
            for (Listener listener : listeners) {
                try {
                    listener.onHealthChange(storeKey, previous, status.result());
                } catch (RuntimeException e) {
                    log.error("Store health listener failed for {}: {}", storeKey, e.getMessage(), e);
                }
            }
        }
        return status;
    }

    private ValidationStatus validate(StoreKey storeKey) {
        Optional<SecretStoreDefinition> definition = storeRepository.find(storeKey);
        if (definition.isEmpty()) {
            return ValidationStatus.error(new ConfigurationException("Store " + storeKey + " not found"));
        }
        SecretStoreDefinition store = definition.get();
        try {
            Provider provider = providerRegistry.require(store.provider().variantTag());
            provider.validateConfig(store);
            try (SecretsClient client = provider.newClient(store, credentialResolver, store.namespace())) {
                return client.validate();
            }
        } catch (SecretSyncException e) {
            return ValidationStatus.error(e);
        } catch (RuntimeException e) {
            log.error("Unexpected error validating store {}: {}", storeKey, e.getMessage(), e);
            return ValidationStatus.error(new BackendException("Unexpected error validating store " + storeKey, e));
        }
    }

    private void probeAllSafely() {
        try {
            probeAll();
        } catch (RuntimeException e) {
            log.error("Periodic store health check failed: {}", e.getMessage(), e);
        }
    }
}
