package tech.yump.secretsync.provider;

import tech.yump.secretsync.provider.error.SecretSyncException;

import java.util.Map;

/**
 * Normalized operation set every backend implements. A client owns one authenticated session,
 * is used by a single reconcile pass and is closed exactly once at the end of it.
 */
public interface SecretsClient extends AutoCloseable {

    /**
     * Returns the raw value of one secret. An empty version means latest; a version token the backend
     * cannot parse fails with {@code InvalidVersionException} before any network call.
     */
    byte[] getSecret(RemoteRef ref) throws SecretSyncException;

    /**
     * Fetches one secret whose payload is a JSON object and flattens its top-level keys.
     */
    Map<String, byte[]> getSecretMap(RemoteRef ref) throws SecretSyncException;

    /**
     * Lists visible secrets, filters them by {@code query} and returns name to latest value.
     * The first failing fetch fails the whole call.
     */
    Map<String, byte[]> getAllSecrets(FindQuery query) throws SecretSyncException;

    /**
     * Creates or updates {@link PushSpec#remoteKey()}. Pushing an unchanged value is a no-op.
     */
    void pushSecret(PushSpec spec, Map<String, byte[]> sourceData) throws SecretSyncException;

    /**
     * Deletes a secret. Deleting a missing secret is not an error.
     */
    void deleteSecret(String remoteKey) throws SecretSyncException;

    boolean secretExists(String remoteKey) throws SecretSyncException;

    /**
     * Lightweight, non-mutating round trip asserting reachability and valid authentication.
     */
    ValidationStatus validate();

    @Override
    void close() throws SecretSyncException;
}
