package tech.yump.secretsync.cluster;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import tech.yump.secretsync.provider.CredentialResolver;
import tech.yump.secretsync.provider.CredentialScope;
import tech.yump.secretsync.provider.error.CredentialResolutionException;
import tech.yump.secretsync.store.SecretKeySelector;
import tech.yump.secretsync.store.StoreKind;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Resolves credential references against the {@link ClusterSecretStore}.
 *
 * <p>References from a namespaced store are confined to the requesting namespace. References from a
 * cluster store may name any namespace and default to the requesting one.
 */
@Slf4j
@RequiredArgsConstructor
public class ClusterCredentialResolver implements CredentialResolver {

    private final ClusterSecretStore clusterSecretStore;

    @Override
    public String resolve(CredentialScope scope, SecretKeySelector reference) throws CredentialResolutionException {
        String namespace = effectiveNamespace(scope, reference);
        ObjectKey secretKey = ObjectKey.of(namespace, reference.name());

        Map<String, byte[]> data = clusterSecretStore.get(secretKey)
                .orElseThrow(() -> new CredentialResolutionException("Credential secret " + secretKey + " not found"));
        byte[] value = data.get(reference.key());
        if (value == null) {
            throw new CredentialResolutionException("Key '" + reference.key() + "' not found in credential secret " + secretKey);
        }
        log.debug("Resolved credential {} for scope {}", reference, scope);
        return new String(value, StandardCharsets.UTF_8);
    }

    private String effectiveNamespace(CredentialScope scope, SecretKeySelector reference) {
        if (scope.storeKind() == StoreKind.CLUSTER_SECRET_STORE) {
            if (reference.hasNamespace()) {
                return reference.namespace();
            }
            if (!StringUtils.hasText(scope.namespace())) {
                throw new CredentialResolutionException("Credential reference " + reference
                        + " of a cluster store needs a namespace when no requesting namespace is known");
            }
            return scope.namespace();
        }
        if (!StringUtils.hasText(scope.namespace())) {
            throw new CredentialResolutionException("Cannot resolve " + reference + " without a namespace");
        }
        if (reference.hasNamespace() && !reference.namespace().equals(scope.namespace())) {
            throw new CredentialResolutionException("Cross-namespace credential reference " + reference
                    + " denied from namespace '" + scope.namespace() + "'");
        }
        return scope.namespace();
    }
}
