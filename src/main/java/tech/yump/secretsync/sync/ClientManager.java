package tech.yump.secretsync.sync;

import lombok.extern.slf4j.Slf4j;
import tech.yump.secretsync.provider.Capabilities;
import tech.yump.secretsync.provider.CredentialResolver;
import tech.yump.secretsync.provider.Provider;
import tech.yump.secretsync.provider.ProviderRegistry;
import tech.yump.secretsync.provider.SecretsClient;
import tech.yump.secretsync.provider.error.CapabilityMismatchException;
import tech.yump.secretsync.provider.error.ConfigurationException;
import tech.yump.secretsync.provider.error.SecretSyncException;
import tech.yump.secretsync.store.SecretStoreDefinition;
import tech.yump.secretsync.store.StoreKey;
import tech.yump.secretsync.store.StoreRepository;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds and caches the clients of one reconcile pass, one per store, and closes them all at the end
 * of the pass. Never shared between passes.
 */
@Slf4j
public class ClientManager implements AutoCloseable {

    /**
     * What the pass needs the client for.
     */
    public enum Access {
        READ,
        WRITE
    }

    private final ProviderRegistry providerRegistry;
    private final StoreRepository storeRepository;
    private final CredentialResolver credentialResolver;
    private final String namespace;
    private final Map<StoreKey, SecretsClient> clients = new LinkedHashMap<>();

    public ClientManager(ProviderRegistry providerRegistry, StoreRepository storeRepository,
                         CredentialResolver credentialResolver, String namespace) {
        this.providerRegistry = providerRegistry;
        this.storeRepository = storeRepository;
        this.credentialResolver = credentialResolver;
        this.namespace = namespace;
    }

    /**
     * Returns the client of {@code storeKey}, building it on first use.
     *
     * @throws ConfigurationException      if the store is unknown or references an unknown provider
     * @throws CapabilityMismatchException if the provider does not support {@code access}
     */
    public SecretsClient get(StoreKey storeKey, Access access) throws SecretSyncException {
        SecretStoreDefinition store = storeRepository.find(storeKey)
                .orElseThrow(() -> new ConfigurationException("Store " + storeKey + " not found"));
        Provider provider = providerRegistry.require(store.provider().variantTag());
        checkCapabilities(storeKey, provider.capabilities(), access);

        SecretsClient client = clients.get(storeKey);
        if (client == null) {
            client = provider.newClient(store, credentialResolver, namespace);
            clients.put(storeKey, client);
            log.debug("Created {} client for store {} in namespace '{}'", provider.variantTag(), storeKey, namespace);
        }
        return client;
    }

    @Override
    public void close() {
        for (Map.Entry<StoreKey, SecretsClient> entry : clients.entrySet()) {
            try {
                entry.getValue().close();
            } catch (RuntimeException e) {
                log.warn("Failed to close client of store {}: {}", entry.getKey(), e.getMessage(), e);
            }
        }
        clients.clear();
    }

    private static void checkCapabilities(StoreKey storeKey, Capabilities capabilities, Access access) {
        if (access == Access.READ && !capabilities.canRead()) {
            throw new CapabilityMismatchException("Store " + storeKey + " is " + capabilities + " and cannot be read from");
        }
        if (access == Access.WRITE && !capabilities.canWrite()) {
            throw new CapabilityMismatchException("Store " + storeKey + " is " + capabilities + " and cannot be pushed to");
        }
    }
}
