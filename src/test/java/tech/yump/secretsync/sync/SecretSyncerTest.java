package tech.yump.secretsync.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.yump.secretsync.backend.memory.InMemorySecretVault;
import tech.yump.secretsync.backend.memory.MemoryProvider;
import tech.yump.secretsync.cluster.ClusterCredentialResolver;
import tech.yump.secretsync.cluster.InMemoryClusterSecretStore;
import tech.yump.secretsync.cluster.ObjectKey;
import tech.yump.secretsync.provider.DataExtractor;
import tech.yump.secretsync.provider.FindQuery;
import tech.yump.secretsync.provider.MaintenanceStatus;
import tech.yump.secretsync.provider.ProviderRegistry;
import tech.yump.secretsync.provider.PushSpec;
import tech.yump.secretsync.provider.RemoteRef;
import tech.yump.secretsync.provider.error.ConfigurationException;
import tech.yump.secretsync.provider.error.SecretNotFoundException;
import tech.yump.secretsync.provider.error.SourceSecretNotFoundException;
import tech.yump.secretsync.store.MemoryProviderConfig;
import tech.yump.secretsync.store.ProviderSpec;
import tech.yump.secretsync.store.SecretStoreDefinition;
import tech.yump.secretsync.store.StoreKey;
import tech.yump.secretsync.store.StoreKind;
import tech.yump.secretsync.store.StoreRef;
import tech.yump.secretsync.store.StoreRepository;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SecretSyncerTest {

    private static final StoreKey STORE = StoreKey.namespaced("team-a", "mem");
    private static final ObjectKey SOURCE = ObjectKey.of("team-a", "app-creds");

    private InMemorySecretVault vault;
    private InMemoryClusterSecretStore clusterSecrets;
    private SecretSyncer syncer;

    @BeforeEach
    void setUp() {
        MemoryProvider memoryProvider = new MemoryProvider(new DataExtractor(new ObjectMapper()));
        vault = memoryProvider.createVault("main", null);
        ProviderRegistry registry = ProviderRegistry.builder()
                .register(memoryProvider.variantTag(), memoryProvider, MaintenanceStatus.MAINTAINED)
                .build();
        StoreRepository stores = new StoreRepository(List.of(new SecretStoreDefinition("mem", StoreKind.SECRET_STORE,
                "team-a", ProviderSpec.memory(new MemoryProviderConfig("main", null)))));
        clusterSecrets = new InMemoryClusterSecretStore();
        syncer = new SecretSyncer(registry, stores, new ClusterCredentialResolver(clusterSecrets), clusterSecrets);
    }

    private static byte[] utf8(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static String str(byte[] value) {
        return new String(value, StandardCharsets.UTF_8);
    }

    private static SecretSyncDefinition pull(List<DataRef> data, List<DataFromRef> dataFrom) {
        return new SecretSyncDefinition("team-a", "app", StoreRef.named("mem"), null, "app-secret",
                data, dataFrom, null, null, null, null);
    }

    private static SecretSyncDefinition push(List<PushRef> push, DeletionPolicy deletionPolicy, UpdatePolicy updatePolicy) {
        return new SecretSyncDefinition("team-a", "app", StoreRef.named("mem"), null, null,
                null, null, SOURCE.name(), push, deletionPolicy, updatePolicy);
    }

    @Test
    @DisplayName("sync: Pulls dataFrom first and lets explicit data items override")
    void sync_pullMergesDataFromAndData() {
        vault.write("db", utf8("{\"user\":\"admin\",\"password\":\"from-extract\"}"));
        vault.write("db-password", utf8("explicit"));
        vault.write("test-a", utf8("a"));

        SyncResult result = syncer.sync(pull(
                List.of(new DataRef("password", null, RemoteRef.of("db-password"))),
                List.of(new DataFromRef(null, RemoteRef.of("db"), null),
                        new DataFromRef(null, null, FindQuery.byName("test-.*")))), Set.of());

        assertThat(result.target()).isEqualTo(ObjectKey.of("team-a", "app-secret"));
        assertThat(result.data()).containsOnlyKeys("user", "password", "test-a");
        assertThat(str(result.data().get("password"))).isEqualTo("explicit");
        assertThat(result.pushed()).isEmpty();
    }

    @Test
    @DisplayName("sync: Fails the pass when a pulled secret is missing")
    void sync_missingRemote_throws() {
        assertThatThrownBy(() -> syncer.sync(pull(List.of(new DataRef("k", null, RemoteRef.of("nope"))), null), Set.of()))
                .isInstanceOf(SecretNotFoundException.class);
    }

    @Test
    @DisplayName("sync: Pushes source data and reports every pushed secret")
    void sync_push() {
        clusterSecrets.put(SOURCE, Map.of("password", utf8("s3cret"), "user", utf8("app")));

        SyncResult result = syncer.sync(push(List.of(
                new PushRef(null, new PushSpec("password", "app-password", null)),
                new PushRef(null, new PushSpec(null, "app-all", null))), null, null), Set.of());

        assertThat(result.target()).isNull();
        assertThat(result.pushed()).containsExactlyInAnyOrder(new PushedRef(STORE, "app-password"), new PushedRef(STORE, "app-all"));
        assertThat(vault.read("app-password", null)).get().extracting(SecretSyncerTest::str).isEqualTo("s3cret");
        assertThat(vault.read("app-all", null)).get().extracting(SecretSyncerTest::str)
                .isEqualTo("{\"password\":\"s3cret\",\"user\":\"app\"}");
    }

    @Test
    @DisplayName("sync: A missing source secret fails with SOURCE_SECRET_NOT_FOUND")
    void sync_missingSource_throws() {
        assertThatThrownBy(() -> syncer.sync(push(List.of(new PushRef(null, new PushSpec(null, "x", null))), null, null), Set.of()))
                .isInstanceOf(SourceSecretNotFoundException.class)
                .hasMessageContaining("team-a/app-creds");
    }

    @Test
    @DisplayName("sync: IF_NOT_EXISTS leaves foreign secrets alone but keeps owning its own")
    void sync_ifNotExists() {
        clusterSecrets.put(SOURCE, Map.of("password", utf8("new")));
        vault.write("foreign", utf8("keep"));
        SecretSyncDefinition definition = push(List.of(
                new PushRef(null, new PushSpec("password", "foreign", null)),
                new PushRef(null, new PushSpec("password", "owned", null))), DeletionPolicy.DELETE, UpdatePolicy.IF_NOT_EXISTS);

        SyncResult first = syncer.sync(definition, Set.of());
        SyncResult second = syncer.sync(definition, first.pushed());

        assertThat(vault.read("foreign", null)).get().extracting(SecretSyncerTest::str).isEqualTo("keep");
        assertThat(first.pushed()).containsExactly(new PushedRef(STORE, "owned"));
        assertThat(second.pushed()).containsExactly(new PushedRef(STORE, "owned"));
        assertThat(vault.read("owned", null)).isPresent();
    }

    @Test
    @DisplayName("sync: With DELETE, secrets no longer pushed are removed")
    void sync_deletesStalePushes() {
        clusterSecrets.put(SOURCE, Map.of("password", utf8("s3cret")));
        vault.write("old-name", utf8("s3cret"));
        Set<PushedRef> previous = Set.of(new PushedRef(STORE, "old-name"));

        syncer.sync(push(List.of(new PushRef(null, new PushSpec("password", "new-name", null))),
                DeletionPolicy.DELETE, null), previous);

        assertThat(vault.read("old-name", null)).isEmpty();
        assertThat(vault.read("new-name", null)).isPresent();
    }

    @Test
    @DisplayName("sync: With NONE, stale pushes are kept")
    void sync_keepsStalePushesWithoutDeletePolicy() {
        clusterSecrets.put(SOURCE, Map.of("password", utf8("s3cret")));
        vault.write("old-name", utf8("s3cret"));

        syncer.sync(push(List.of(new PushRef(null, new PushSpec("password", "new-name", null))),
                DeletionPolicy.NONE, null), Set.of(new PushedRef(STORE, "old-name")));

        assertThat(vault.read("old-name", null)).isPresent();
    }

    @Test
    @DisplayName("cleanup: Deletes every pushed secret under DELETE only")
    void cleanup() {
        vault.write("a", utf8("1"));
        Set<PushedRef> pushed = Set.of(new PushedRef(STORE, "a"));

        syncer.cleanup(push(List.of(new PushRef(null, new PushSpec(null, "a", null))), DeletionPolicy.NONE, null), pushed);
        assertThat(vault.read("a", null)).isPresent();

        syncer.cleanup(push(List.of(new PushRef(null, new PushSpec(null, "a", null))), DeletionPolicy.DELETE, null), pushed);
        assertThat(vault.read("a", null)).isEmpty();
    }

    @Test
    @DisplayName("sync: An unknown store is a configuration error")
    void sync_unknownStore_throws() {
        SecretSyncDefinition definition = new SecretSyncDefinition("team-a", "app", StoreRef.named("missing"), null, null,
                List.of(new DataRef("k", null, RemoteRef.of("db"))), null, null, null, null, null);

        assertThatThrownBy(() -> syncer.sync(definition, Set.of()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("team-a/missing");
    }
}
