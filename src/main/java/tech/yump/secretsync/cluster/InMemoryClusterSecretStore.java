package tech.yump.secretsync.cluster;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link ClusterSecretStore}. Data is copied on the way in and out so callers never
 * share byte arrays.
 */
@Slf4j
public class InMemoryClusterSecretStore implements ClusterSecretStore {

    private final Map<ObjectKey, Map<String, byte[]>> secrets = new ConcurrentHashMap<>();

    @Override
    public Optional<Map<String, byte[]>> get(ObjectKey key) {
        return Optional.ofNullable(secrets.get(key)).map(InMemoryClusterSecretStore::copy);
    }

    @Override
    public void put(ObjectKey key, Map<String, byte[]> data) {
        secrets.put(key, Collections.unmodifiableMap(copy(data)));
        log.debug("Stored cluster secret {} with keys {}", key, data.keySet());
    }

    @Override
    public void delete(ObjectKey key) {
        if (secrets.remove(key) != null) {
            log.debug("Deleted cluster secret {}", key);
        }
    }

    private static Map<String, byte[]> copy(Map<String, byte[]> data) {
        Map<String, byte[]> copy = new HashMap<>(data.size());
        data.forEach((k, v) -> copy.put(k, v.clone()));
        return copy;
    }
}
