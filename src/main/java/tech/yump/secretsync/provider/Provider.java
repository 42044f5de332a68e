package tech.yump.secretsync.provider;

import tech.yump.secretsync.provider.error.BackendConnectException;
import tech.yump.secretsync.provider.error.ConfigurationException;
import tech.yump.secretsync.provider.error.CredentialResolutionException;
import tech.yump.secretsync.store.SecretStoreDefinition;

import java.util.List;

/**
 * Per-backend factory of {@link SecretsClient} instances.
 */
public interface Provider {

    /**
     * Tag of the {@link tech.yump.secretsync.store.ProviderSpec} variant this provider serves.
     */
    String variantTag();

    Capabilities capabilities();

    default MaintenanceStatus maintenanceStatus() {
        return MaintenanceStatus.MAINTAINED;
    }

    /**
     * Resolves the store's credentials and builds an authenticated client.
     *
     * @param store     store definition carrying this provider's config variant
     * @param resolver  credential resolver enforcing cross-namespace policy
     * @param namespace namespace of the object the client is built for
     * @throws ConfigurationException         if required configuration is absent
     * @throws CredentialResolutionException if a credential reference cannot be resolved
     * @throws BackendConnectException        if authentication against the backend fails
     */
    SecretsClient newClient(SecretStoreDefinition store, CredentialResolver resolver, String namespace)
            throws ConfigurationException, CredentialResolutionException, BackendConnectException;

    /**
     * Structural validation of the store's configuration. Performs no I/O.
     *
     * @return warnings, empty when none
     * @throws ConfigurationException if the configuration is unusable
     */
    List<String> validateConfig(SecretStoreDefinition store) throws ConfigurationException;
}
