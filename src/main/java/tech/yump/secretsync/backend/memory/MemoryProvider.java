package tech.yump.secretsync.backend.memory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;
import tech.yump.secretsync.provider.Capabilities;
import tech.yump.secretsync.provider.CredentialResolver;
import tech.yump.secretsync.provider.DataExtractor;
import tech.yump.secretsync.provider.Provider;
import tech.yump.secretsync.provider.SecretsClient;
import tech.yump.secretsync.provider.StoreValidation;
import tech.yump.secretsync.provider.error.BackendConnectException;
import tech.yump.secretsync.provider.error.ConfigurationException;
import tech.yump.secretsync.store.MemoryProviderConfig;
import tech.yump.secretsync.store.ProviderSpec;
import tech.yump.secretsync.store.SecretStoreDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provider of the in-process {@code memory} backend. Vaults are created on first use, or registered
 * up front through {@link #createVault(String, String)}.
 */
@Slf4j
public class MemoryProvider implements Provider {

    private final Map<String, InMemorySecretVault> vaults = new ConcurrentHashMap<>();
    private final DataExtractor dataExtractor;

    public MemoryProvider(DataExtractor dataExtractor) {
        this.dataExtractor = dataExtractor;
    }

    public InMemorySecretVault createVault(String vaultId, @Nullable String authToken) {
        InMemorySecretVault vault = new InMemorySecretVault(vaultId, authToken);
        if (vaults.putIfAbsent(vaultId, vault) != null) {
            throw new IllegalStateException("Memory vault '" + vaultId + "' already exists");
        }
        log.info("Created memory vault '{}' (token protected: {})", vaultId, authToken != null);
        return vault;
    }

    public InMemorySecretVault vault(String vaultId) {
        return vaults.computeIfAbsent(vaultId, id -> new InMemorySecretVault(id, null));
    }

    @Override
    public String variantTag() {
        return ProviderSpec.MEMORY;
    }

    @Override
    public Capabilities capabilities() {
        return Capabilities.READ_WRITE;
    }

    @Override
    public SecretsClient newClient(SecretStoreDefinition store, CredentialResolver resolver, String namespace) {
        MemoryProviderConfig config = StoreValidation.requireVariant(store, ProviderSpec.MEMORY, s -> s.provider().memory());
        String token = null;
        if (config.authToken() != null) {
            token = resolver.resolve(StoreValidation.scopeOf(store, namespace), config.authToken());
        }
        InMemorySecretVault vault = vault(config.vaultId());
        if (!vault.authenticate(token)) {
            throw new BackendConnectException("Authentication to memory vault '" + config.vaultId() + "' failed for store " + store.key());
        }
        return new MemorySecretsClient(vault, dataExtractor);
    }

    @Override
    public List<String> validateConfig(SecretStoreDefinition store) throws ConfigurationException {
        MemoryProviderConfig config = StoreValidation.requireVariant(store, ProviderSpec.MEMORY, s -> s.provider().memory());
        if (!StringUtils.hasText(config.vaultId())) {
            throw new ConfigurationException("Store " + store.key() + ": memory vault id must be provided");
        }
        StoreValidation.validateReferent(store, config.authToken(), "authToken");
        List<String> warnings = new ArrayList<>();
        if (config.authToken() == null) {
            warnings.add("Store " + store.key() + " connects to memory vault '" + config.vaultId() + "' without an auth token");
        }
        return warnings;
    }
}
