package tech.yump.secretsync.provider;

import tech.yump.secretsync.provider.error.CredentialResolutionException;
import tech.yump.secretsync.store.SecretKeySelector;

/**
 * Resolves credential references into plaintext, enforcing cross-namespace access policy.
 * Callers must not keep the plaintext beyond the lifetime of the client built from it.
 */
@FunctionalInterface
public interface CredentialResolver {

    /**
     * @throws CredentialResolutionException if the reference is missing, not readable from {@code scope},
     *                                       or points at a missing key
     */
    String resolve(CredentialScope scope, SecretKeySelector reference) throws CredentialResolutionException;
}
