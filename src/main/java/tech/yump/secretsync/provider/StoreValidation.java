package tech.yump.secretsync.provider;

import tech.yump.secretsync.provider.error.ConfigurationException;
import tech.yump.secretsync.store.SecretKeySelector;
import tech.yump.secretsync.store.SecretStoreDefinition;
import tech.yump.secretsync.store.StoreKind;

import java.util.function.Function;

/**
 * Configuration checks shared by all providers.
 */
public final class StoreValidation {

    private StoreValidation() {
    }

    /**
     * Returns the provider config variant of {@code store}, failing when the store does not carry one.
     */
    public static <T> T requireVariant(SecretStoreDefinition store, String tag, Function<SecretStoreDefinition, T> extractor)
            throws ConfigurationException {
        if (store == null) {
            throw new ConfigurationException("Found null store definition");
        }
        if (store.provider() == null) {
            throw new ConfigurationException("Store " + store.key() + " is missing a provider");
        }
        T config = extractor.apply(store);
        if (config == null) {
            throw new ConfigurationException("Invalid provider spec: missing '" + tag + "' configuration in store " + store.key());
        }
        return config;
    }

    /**
     * A namespaced store may only reference credentials in its own namespace. Cluster stores may
     * reference any namespace but must name it, since their health checks run outside any namespace.
     */
    public static void validateReferent(SecretStoreDefinition store, SecretKeySelector selector, String field)
            throws ConfigurationException {
        if (selector == null) {
            return;
        }
        if (store.kind() == StoreKind.SECRET_STORE && selector.hasNamespace()
                && !selector.namespace().equals(store.namespace())) {
            throw new ConfigurationException("Invalid " + field + ": namespace '" + selector.namespace()
                    + "' must be empty or equal to the store namespace '" + store.namespace() + "'");
        }
        if (store.kind() == StoreKind.CLUSTER_SECRET_STORE && !selector.hasNamespace()) {
            throw new ConfigurationException("Invalid " + field + ": a cluster store must set the namespace of "
                    + selector.name() + "[" + selector.key() + "]");
        }
    }

    public static CredentialScope scopeOf(SecretStoreDefinition store, String namespace) {
        return new CredentialScope(store.kind(), namespace);
    }
}
