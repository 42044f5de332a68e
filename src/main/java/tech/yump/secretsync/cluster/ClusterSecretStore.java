package tech.yump.secretsync.cluster;

import java.util.Map;
import java.util.Optional;

/**
 * The cluster's native secret store: source of credentials and pushed data, destination of pulled data.
 */
public interface ClusterSecretStore {

    Optional<Map<String, byte[]>> get(ObjectKey key);

    /**
     * Replaces the whole data of the secret, creating it when absent.
     */
    void put(ObjectKey key, Map<String, byte[]> data);

    /**
     * Deletes the secret if it exists.
     */
    void delete(ObjectKey key);
}
