package tech.yump.secretsync.sync;

import lombok.extern.slf4j.Slf4j;
import tech.yump.secretsync.cluster.ObjectKey;
import tech.yump.secretsync.store.StoreKey;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Current sync definitions, keyed by namespace and name.
 */
@Slf4j
public class SyncDefinitionRepository {

    private final Map<ObjectKey, SecretSyncDefinition> definitions = new ConcurrentHashMap<>();

    /**
     * @return the replaced definition, if any
     */
    public Optional<SecretSyncDefinition> put(SecretSyncDefinition definition) {
        SecretSyncDefinition previous = definitions.put(definition.key(), definition);
        log.debug("{} sync definition {}", previous == null ? "Added" : "Replaced", definition.key());
        return Optional.ofNullable(previous);
    }

    public Optional<SecretSyncDefinition> remove(ObjectKey key) {
        SecretSyncDefinition removed = definitions.remove(key);
        if (removed != null) {
            log.debug("Removed sync definition {}", key);
        }
        return Optional.ofNullable(removed);
    }

    public Optional<SecretSyncDefinition> find(ObjectKey key) {
        return Optional.ofNullable(definitions.get(key));
    }

    public List<SecretSyncDefinition> all() {
        return List.copyOf(definitions.values());
    }

    /**
     * Definitions that read from or write to {@code store}.
     */
    public List<SecretSyncDefinition> dependentsOf(StoreKey store) {
        return definitions.values().stream()
                .filter(definition -> definition.storeKeys().contains(store))
                .toList();
    }
}
