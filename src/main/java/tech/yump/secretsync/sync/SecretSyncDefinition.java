package tech.yump.secretsync.sync;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;
import tech.yump.secretsync.cluster.ObjectKey;
import tech.yump.secretsync.provider.error.ConfigurationException;
import tech.yump.secretsync.store.StoreKey;
import tech.yump.secretsync.store.StoreRef;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Declares which remote secrets are pulled into a cluster secret and which cluster secret data is
 * pushed to backends.
 *
 * @param storeRef        default store of every item that names none
 * @param refreshInterval time between successful passes; {@code null} for the global default, zero to sync only on change
 * @param target          name of the cluster secret receiving pulled data; defaults to {@code name}
 * @param source          name of the cluster secret pushed from
 */
public record SecretSyncDefinition(
        @NotBlank(message = "Sync namespace must be provided.")
        String namespace,
        @NotBlank(message = "Sync name must be provided.")
        String name,
        @Valid @Nullable StoreRef storeRef,
        @Nullable Duration refreshInterval,
        @Nullable String target,
        @Valid List<DataRef> data,
        @Valid List<DataFromRef> dataFrom,
        @Nullable String source,
        @Valid List<PushRef> push,
        DeletionPolicy deletionPolicy,
        UpdatePolicy updatePolicy
) {

    public SecretSyncDefinition {
        data = data == null ? List.of() : List.copyOf(data);
        dataFrom = dataFrom == null ? List.of() : List.copyOf(dataFrom);
        push = push == null ? List.of() : List.copyOf(push);
        if (deletionPolicy == null) {
            deletionPolicy = DeletionPolicy.NONE;
        }
        if (updatePolicy == null) {
            updatePolicy = UpdatePolicy.REPLACE;
        }
    }

    @AssertTrue(message = "Every data, dataFrom and push item needs a store reference when the sync declares no default store.")
    public boolean isStoreReferenceValid() {
        if (storeRef != null) {
            return true;
        }
        return data.stream().allMatch(d -> d.storeRef() != null)
                && dataFrom.stream().allMatch(d -> d.storeRef() != null)
                && push.stream().allMatch(p -> p.storeRef() != null);
    }

    @AssertTrue(message = "A sync with push items must name its source secret.")
    public boolean isSourceValid() {
        return push.isEmpty() || StringUtils.hasText(source);
    }

    @AssertTrue(message = "Refresh interval cannot be negative.")
    public boolean isRefreshIntervalValid() {
        return refreshInterval == null || !refreshInterval.isNegative();
    }

    public ObjectKey key() {
        return ObjectKey.of(namespace, name);
    }

    public boolean pulls() {
        return !data.isEmpty() || !dataFrom.isEmpty();
    }

    public ObjectKey targetKey() {
        return ObjectKey.of(namespace, StringUtils.hasText(target) ? target : name);
    }

    public ObjectKey sourceKey() {
        return ObjectKey.of(namespace, source);
    }

    /**
     * Resolves an item's store reference, falling back to the definition's default.
     *
     * @throws ConfigurationException if neither is set
     */
    public StoreKey storeKeyFor(@Nullable StoreRef itemRef) throws ConfigurationException {
        StoreRef ref = itemRef != null ? itemRef : storeRef;
        if (ref == null) {
            throw new ConfigurationException("Sync " + key() + " has an item without store reference and no default store");
        }
        return ref.resolve(namespace);
    }

    /**
     * Every store this definition reads from or writes to.
     */
    public Set<StoreKey> storeKeys() {
        Set<StoreKey> keys = new LinkedHashSet<>();
        data.forEach(d -> keys.add(storeKeyFor(d.storeRef())));
        dataFrom.forEach(d -> keys.add(storeKeyFor(d.storeRef())));
        push.forEach(p -> keys.add(storeKeyFor(p.storeRef())));
        return keys;
    }
}
