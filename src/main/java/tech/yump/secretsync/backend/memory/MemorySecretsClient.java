package tech.yump.secretsync.backend.memory;

import org.springframework.lang.Nullable;
import tech.yump.secretsync.provider.AbstractSecretsClient;
import tech.yump.secretsync.provider.DataExtractor;
import tech.yump.secretsync.provider.SecretSummary;
import tech.yump.secretsync.provider.error.BackendException;
import tech.yump.secretsync.provider.error.InvalidVersionException;
import tech.yump.secretsync.provider.error.SecretNotFoundException;

import java.util.List;
import java.util.Optional;

/**
 * Client bound to one {@link InMemorySecretVault}. Versions are positive integers.
 */
public class MemorySecretsClient extends AbstractSecretsClient<Integer> {

    private final InMemorySecretVault vault;

    public MemorySecretsClient(InMemorySecretVault vault, DataExtractor dataExtractor) {
        super(dataExtractor);
        this.vault = vault;
    }

    @Override
    protected Integer parseVersion(String version) throws InvalidVersionException {
        // versions count from 1; signs are not part of the format
        int parsed;
        try {
            parsed = version.startsWith("+") ? 0 : Integer.parseInt(version);
        } catch (NumberFormatException e) {
            throw new InvalidVersionException("Invalid version '" + version + "': expected a positive integer", e);
        }
        if (parsed < 1) {
            throw new InvalidVersionException("Invalid version '" + version + "': expected a positive integer");
        }
        return parsed;
    }

    @Override
    protected byte[] readValue(String key, @Nullable Integer version) {
        ensureAvailable();
        return vault.read(key, version).orElseThrow(() -> new SecretNotFoundException(
                "Secret '" + key + "'" + (version == null ? "" : " version " + version) + " not found in vault '" + vault.getId() + "'"));
    }

    @Override
    protected Optional<byte[]> findLatest(String key) {
        ensureAvailable();
        return vault.read(key, null);
    }

    @Override
    protected List<SecretSummary> listSecrets() {
        ensureAvailable();
        return vault.list();
    }

    @Override
    protected void writeValue(String key, byte[] value, boolean exists) {
        ensureAvailable();
        vault.write(key, value);
    }

    @Override
    protected boolean removeValue(String key) {
        ensureAvailable();
        return vault.remove(key);
    }

    private void ensureAvailable() {
        if (!vault.isAvailable()) {
            throw new BackendException("Memory vault '" + vault.getId() + "' is unavailable");
        }
    }
}
