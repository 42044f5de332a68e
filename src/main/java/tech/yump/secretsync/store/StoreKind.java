package tech.yump.secretsync.store;

/**
 * Scope of a store definition.
 */
public enum StoreKind {
    /** Lives in one namespace and serves only objects of that namespace. */
    SECRET_STORE,
    /** Has no namespace and may be referenced from any namespace. */
    CLUSTER_SECRET_STORE
}
