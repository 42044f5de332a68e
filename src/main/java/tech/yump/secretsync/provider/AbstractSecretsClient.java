package tech.yump.secretsync.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import tech.yump.secretsync.provider.error.BackendException;
import tech.yump.secretsync.provider.error.InvalidVersionException;
import tech.yump.secretsync.provider.error.SecretNotFoundException;
import tech.yump.secretsync.provider.error.SecretSyncException;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Implements the {@link SecretsClient} semantics on top of a handful of native backend primitives,
 * so that every backend resolves versions, flattens payloads, filters names and upserts the same way.
 *
 * @param <V> the backend's parsed version token
 */
@Slf4j
public abstract class AbstractSecretsClient<V> implements SecretsClient {

    protected final DataExtractor dataExtractor;

    protected AbstractSecretsClient(DataExtractor dataExtractor) {
        this.dataExtractor = dataExtractor;
    }

    // --- Backend primitives ---

    /**
     * Parses a non-empty version token. Must not perform I/O.
     *
     * @throws InvalidVersionException if the token is not valid for this backend
     */
    protected abstract V parseVersion(String version) throws InvalidVersionException;

    /**
     * Reads a secret value; a {@code null} version means latest.
     *
     * @throws SecretNotFoundException if the secret or version does not exist
     */
    protected abstract byte[] readValue(String key, @Nullable V version) throws SecretSyncException;

    /**
     * Reads the latest value, or empty when the secret does not exist.
     */
    protected abstract Optional<byte[]> findLatest(String key) throws SecretSyncException;

    protected abstract List<SecretSummary> listSecrets() throws SecretSyncException;

    /**
     * Stores a new value. {@code exists} tells whether the secret was found by {@link #findLatest}.
     */
    protected abstract void writeValue(String key, byte[] value, boolean exists) throws SecretSyncException;

    /**
     * Removes a secret with all its versions.
     *
     * @return false when there was nothing to remove
     */
    protected abstract boolean removeValue(String key) throws SecretSyncException;

    // --- Contract ---

    @Override
    public byte[] getSecret(RemoteRef ref) throws SecretSyncException {
        V version = ref.hasVersion() ? parseVersion(ref.version()) : null;
        byte[] value = readValue(ref.key(), version);
        if (ref.hasProperty()) {
            return dataExtractor.extractProperty(ref.key(), value, ref.property());
        }
        return value;
    }

    @Override
    public Map<String, byte[]> getSecretMap(RemoteRef ref) throws SecretSyncException {
        V version = ref.hasVersion() ? parseVersion(ref.version()) : null;
        byte[] value = readValue(ref.key(), version);
        if (ref.hasProperty()) {
            value = dataExtractor.extractProperty(ref.key(), value, ref.property());
        }
        return dataExtractor.flatten(ref.key(), value);
    }

    @Override
    public Map<String, byte[]> getAllSecrets(FindQuery query) throws SecretSyncException {
        NameMatcher matcher = query.hasNameFilter() ? NameMatcher.compile(query.name()) : null;

        Map<String, byte[]> result = new HashMap<>();
        for (SecretSummary secret : listSecrets()) {
            if (matcher != null && !matcher.matches(secret.name())) {
                continue;
            }
            if (!secret.hasTags(query.tags())) {
                continue;
            }
            try {
                result.put(secret.name(), readValue(secret.name(), null));
            } catch (SecretSyncException e) {
                log.warn("Fetching '{}' failed while collecting secrets for filter '{}': {}", secret.name(), matcher, e.getMessage());
                throw e;
            }
        }
        log.debug("Found {} secrets matching name filter '{}' and tags {}", result.size(), matcher, query.tags().keySet());
        return result;
    }

    @Override
    public void pushSecret(PushSpec spec, Map<String, byte[]> sourceData) throws SecretSyncException {
        byte[] value = dataExtractor.resolvePushValue(spec, sourceData);
        Optional<byte[]> current = findLatest(spec.remoteKey());
        if (spec.hasProperty()) {
            value = dataExtractor.mergeProperty(spec.remoteKey(), current.orElse(null), spec.property(), value);
        }
        if (current.isPresent() && Arrays.equals(current.get(), value)) {
            log.debug("Remote secret '{}' is up to date, skipping push", spec.remoteKey());
            return;
        }
        writeValue(spec.remoteKey(), value, current.isPresent());
        log.info("Pushed secret '{}' ({})", spec.remoteKey(), current.isPresent() ? "updated" : "created");
    }

    @Override
    public void deleteSecret(String remoteKey) throws SecretSyncException {
        if (removeValue(remoteKey)) {
            log.info("Deleted remote secret '{}'", remoteKey);
        } else {
            log.debug("Remote secret '{}' did not exist, nothing to delete", remoteKey);
        }
    }

    @Override
    public boolean secretExists(String remoteKey) throws SecretSyncException {
        return listSecrets().stream().anyMatch(secret -> secret.name().equals(remoteKey));
    }

    @Override
    public ValidationStatus validate() {
        try {
            listSecrets();
            return ValidationStatus.ready();
        } catch (SecretSyncException e) {
            log.warn("Client validation failed: {}", e.getMessage());
            return ValidationStatus.error(e);
        } catch (RuntimeException e) {
            log.warn("Client validation failed unexpectedly: {}", e.getMessage(), e);
            return ValidationStatus.error(new BackendException("Failed to validate client: " + e.getMessage(), e));
        }
    }

    @Override
    public void close() throws SecretSyncException {
        // no session to release by default
    }
}
