package tech.yump.secretsync.store;

import jakarta.validation.constraints.NotBlank;

/**
 * Reference from a sync definition to a store.
 */
public record StoreRef(
        @NotBlank(message = "Store reference name must be provided.")
        String name,
        StoreKind kind
) {

    public StoreRef {
        if (kind == null) {
            kind = StoreKind.SECRET_STORE;
        }
    }

    public static StoreRef named(String name) {
        return new StoreRef(name, StoreKind.SECRET_STORE);
    }

    /**
     * Resolves this reference as seen from an object in {@code namespace}.
     */
    public StoreKey resolve(String namespace) {
        return kind == StoreKind.CLUSTER_SECRET_STORE ? StoreKey.cluster(name) : StoreKey.namespaced(namespace, name);
    }
}
