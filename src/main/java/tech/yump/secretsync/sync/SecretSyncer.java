package tech.yump.secretsync.sync;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tech.yump.secretsync.cluster.ClusterSecretStore;
import tech.yump.secretsync.cluster.ObjectKey;
import tech.yump.secretsync.provider.CredentialResolver;
import tech.yump.secretsync.provider.ProviderRegistry;
import tech.yump.secretsync.provider.SecretsClient;
import tech.yump.secretsync.provider.error.SecretSyncException;
import tech.yump.secretsync.provider.error.SourceSecretNotFoundException;
import tech.yump.secretsync.provider.error.SyncTimeoutException;
import tech.yump.secretsync.store.StoreKey;
import tech.yump.secretsync.store.StoreRepository;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Runs one sync pass of a {@link SecretSyncDefinition}: pulls remote data, pushes source data and
 * deletes stale pushes. Clients live only for the duration of the pass.
 */
@Slf4j
@RequiredArgsConstructor
public class SecretSyncer {

    private final ProviderRegistry providerRegistry;
    private final StoreRepository storeRepository;
    private final CredentialResolver credentialResolver;
    private final ClusterSecretStore clusterSecretStore;

    /**
     * @param previouslyPushed remote secrets written by earlier passes of this definition
     */
    public SyncResult sync(SecretSyncDefinition definition, Set<PushedRef> previouslyPushed) throws SecretSyncException {
        try (ClientManager clients = openClients(definition.namespace())) {
            Map<String, byte[]> data = pull(definition, clients);
            Set<PushedRef> pushed = push(definition, previouslyPushed, clients);
            if (definition.deletionPolicy() == DeletionPolicy.DELETE) {
                Set<PushedRef> stale = new LinkedHashSet<>(previouslyPushed);
                stale.removeAll(pushed);
                delete(definition, stale, clients);
            }
            ObjectKey target = definition.pulls() ? definition.targetKey() : null;
            log.debug("Sync pass of {} pulled {} keys and pushed {} secrets", definition.key(), data.size(), pushed.size());
            return new SyncResult(definition.key(), target, data, pushed);
        }
    }

    /**
     * Removes what a deleted definition pushed, when its deletion policy asks for it.
     */
    public void cleanup(SecretSyncDefinition definition, Set<PushedRef> previouslyPushed) throws SecretSyncException {
        if (definition.deletionPolicy() != DeletionPolicy.DELETE || previouslyPushed.isEmpty()) {
            return;
        }
        try (ClientManager clients = openClients(definition.namespace())) {
            delete(definition, previouslyPushed, clients);
        }
    }

    private Map<String, byte[]> pull(SecretSyncDefinition definition, ClientManager clients) {
        Map<String, byte[]> data = new LinkedHashMap<>();
        for (DataFromRef item : definition.dataFrom()) {
            checkInterrupted(definition);
            SecretsClient client = clients.get(definition.storeKeyFor(item.storeRef()), ClientManager.Access.READ);
            if (item.extract() != null) {
                data.putAll(client.getSecretMap(item.extract()));
            } else {
                data.putAll(client.getAllSecrets(item.find()));
            }
        }
        // explicit data items win over keys brought in by dataFrom
        for (DataRef item : definition.data()) {
            checkInterrupted(definition);
            SecretsClient client = clients.get(definition.storeKeyFor(item.storeRef()), ClientManager.Access.READ);
            data.put(item.secretKey(), client.getSecret(item.remoteRef()));
        }
        return data;
    }

    private Set<PushedRef> push(SecretSyncDefinition definition, Set<PushedRef> previouslyPushed, ClientManager clients) {
        if (definition.push().isEmpty()) {
            return Set.of();
        }
        ObjectKey sourceKey = definition.sourceKey();
        Map<String, byte[]> source = clusterSecretStore.get(sourceKey)
                .orElseThrow(() -> new SourceSecretNotFoundException("Source secret " + sourceKey + " of sync " + definition.key() + " not found"));

        Set<PushedRef> pushed = new LinkedHashSet<>();
        for (PushRef item : definition.push()) {
            checkInterrupted(definition);
            StoreKey storeKey = definition.storeKeyFor(item.storeRef());
            SecretsClient client = clients.get(storeKey, ClientManager.Access.WRITE);
            PushedRef ref = new PushedRef(storeKey, item.spec().remoteKey());
            if (definition.updatePolicy() == UpdatePolicy.IF_NOT_EXISTS && client.secretExists(ref.remoteKey())) {
                log.debug("Remote secret {} exists, skipping push of {}", ref, definition.key());
                // still owned when an earlier pass created it
                if (previouslyPushed.contains(ref)) {
                    pushed.add(ref);
                }
                continue;
            }
            client.pushSecret(item.spec(), source);
            pushed.add(ref);
        }
        return pushed;
    }

    private void delete(SecretSyncDefinition definition, Set<PushedRef> refs, ClientManager clients) {
        for (PushedRef ref : refs) {
            checkInterrupted(definition);
            clients.get(ref.store(), ClientManager.Access.WRITE).deleteSecret(ref.remoteKey());
            log.info("Deleted remote secret {} no longer pushed by {}", ref, definition.key());
        }
    }

    private ClientManager openClients(String namespace) {
        return new ClientManager(providerRegistry, storeRepository, credentialResolver, namespace);
    }

    private static void checkInterrupted(SecretSyncDefinition definition) {
        if (Thread.currentThread().isInterrupted()) {
            throw new SyncTimeoutException("Sync pass of " + definition.key() + " was interrupted");
        }
    }
}
