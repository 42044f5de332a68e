package tech.yump.secretsync.store;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Current store definitions, keyed by {@link StoreKey}.
 */
@Slf4j
public class StoreRepository {

    private final Map<StoreKey, SecretStoreDefinition> stores = new ConcurrentHashMap<>();

    public StoreRepository(Collection<SecretStoreDefinition> initial) {
        initial.forEach(this::put);
    }

    public void put(SecretStoreDefinition store) {
        SecretStoreDefinition previous = stores.put(store.key(), store);
        log.info("{} store {} (provider: {})", previous == null ? "Registered" : "Updated", store.key(),
                store.provider().configuredVariants());
    }

    public Optional<SecretStoreDefinition> find(StoreKey key) {
        return Optional.ofNullable(stores.get(key));
    }

    public List<SecretStoreDefinition> all() {
        return List.copyOf(stores.values());
    }
}
