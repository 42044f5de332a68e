package tech.yump.secretsync.backend.local;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import tech.yump.secretsync.provider.Capabilities;
import tech.yump.secretsync.provider.CredentialResolver;
import tech.yump.secretsync.provider.DataExtractor;
import tech.yump.secretsync.provider.Provider;
import tech.yump.secretsync.provider.SecretsClient;
import tech.yump.secretsync.provider.StoreValidation;
import tech.yump.secretsync.provider.error.BackendConnectException;
import tech.yump.secretsync.provider.error.ConfigurationException;
import tech.yump.secretsync.store.LocalVaultProviderConfig;
import tech.yump.secretsync.store.ProviderSpec;
import tech.yump.secretsync.store.SecretStoreDefinition;

import javax.crypto.SecretKey;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;

/**
 * Provider of the {@code local} backend: an AES-GCM encrypted vault on the local filesystem.
 */
@Slf4j
public class LocalVaultProvider implements Provider {

    private final ObjectMapper objectMapper;
    private final DataExtractor dataExtractor;
    private final Clock clock;

    public LocalVaultProvider(ObjectMapper objectMapper, DataExtractor dataExtractor, Clock clock) {
        this.objectMapper = objectMapper;
        this.dataExtractor = dataExtractor;
        this.clock = clock;
    }

    @Override
    public String variantTag() {
        return ProviderSpec.LOCAL;
    }

    @Override
    public Capabilities capabilities() {
        return Capabilities.READ_WRITE;
    }

    @Override
    public SecretsClient newClient(SecretStoreDefinition store, CredentialResolver resolver, String namespace) {
        LocalVaultProviderConfig config = StoreValidation.requireVariant(store, ProviderSpec.LOCAL, s -> s.provider().local());
        Path vaultPath = vaultPath(store, config);

        String encodedKey = resolver.resolve(StoreValidation.scopeOf(store, namespace), config.masterKey());
        SecretKey masterKey;
        try {
            masterKey = EncryptionService.keyFromBase64(encodedKey);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Store " + store.key() + ": invalid master key in " + config.masterKey()
                    + ": " + e.getMessage(), e);
        }

        FileSystemVaultStorage storage = new FileSystemVaultStorage(vaultPath, objectMapper);
        try {
            storage.initialize();
        } catch (StorageException e) {
            throw new BackendConnectException("Store " + store.key() + ": cannot open local vault at " + vaultPath, e);
        }
        log.debug("Opened local vault {} for store {}", storage.getBasePath(), store.key());
        return new LocalVaultSecretsClient(storage, new EncryptionService(masterKey), dataExtractor, clock);
    }

    @Override
    public List<String> validateConfig(SecretStoreDefinition store) throws ConfigurationException {
        LocalVaultProviderConfig config = StoreValidation.requireVariant(store, ProviderSpec.LOCAL, s -> s.provider().local());
        if (config.masterKey() == null) {
            throw new ConfigurationException("Store " + store.key() + ": local vault master key reference must be provided");
        }
        vaultPath(store, config);
        StoreValidation.validateReferent(store, config.masterKey(), "masterKey");
        return List.of();
    }

    private Path vaultPath(SecretStoreDefinition store, LocalVaultProviderConfig config) {
        if (!StringUtils.hasText(config.path())) {
            throw new ConfigurationException("Store " + store.key() + ": local vault path must be provided");
        }
        if (!StringUtils.hasText(config.vaultId())
                || !LocalVaultSecretsClient.SECRET_NAME_PATTERN.matcher(config.vaultId()).matches()) {
            throw new ConfigurationException("Store " + store.key() + ": invalid local vault id '" + config.vaultId() + "'");
        }
        try {
            return Paths.get(config.path(), config.vaultId());
        } catch (InvalidPathException e) {
            throw new ConfigurationException("Store " + store.key() + ": invalid local vault path '" + config.path() + "'", e);
        }
    }
}
