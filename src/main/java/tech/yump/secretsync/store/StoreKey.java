package tech.yump.secretsync.store;

import org.springframework.lang.Nullable;

/**
 * Identity of a store definition. Cluster stores carry no namespace.
 */
public record StoreKey(StoreKind kind, @Nullable String namespace, String name) {

    public static StoreKey cluster(String name) {
        return new StoreKey(StoreKind.CLUSTER_SECRET_STORE, null, name);
    }

    public static StoreKey namespaced(String namespace, String name) {
        return new StoreKey(StoreKind.SECRET_STORE, namespace, name);
    }

    @Override
    public String toString() {
        return kind == StoreKind.CLUSTER_SECRET_STORE ? "cluster/" + name : namespace + "/" + name;
    }
}
