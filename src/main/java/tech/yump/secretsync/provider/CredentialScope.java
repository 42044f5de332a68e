package tech.yump.secretsync.provider;

import org.springframework.lang.Nullable;
import tech.yump.secretsync.store.StoreKind;

/**
 * Scope a credential is resolved from: the kind of store declaring the reference and the
 * namespace of the object (or store) requesting it.
 */
public record CredentialScope(StoreKind storeKind, @Nullable String namespace) {}
