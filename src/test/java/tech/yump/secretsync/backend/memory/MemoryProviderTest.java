package tech.yump.secretsync.backend.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.yump.secretsync.provider.Capabilities;
import tech.yump.secretsync.provider.CredentialResolver;
import tech.yump.secretsync.provider.DataExtractor;
import tech.yump.secretsync.provider.RemoteRef;
import tech.yump.secretsync.provider.SecretsClient;
import tech.yump.secretsync.provider.error.BackendConnectException;
import tech.yump.secretsync.provider.error.ConfigurationException;
import tech.yump.secretsync.store.AwsProviderConfig;
import tech.yump.secretsync.store.MemoryProviderConfig;
import tech.yump.secretsync.store.ProviderSpec;
import tech.yump.secretsync.store.SecretKeySelector;
import tech.yump.secretsync.store.SecretStoreDefinition;
import tech.yump.secretsync.store.StoreKind;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MemoryProviderTest {

    private MemoryProvider provider;

    @BeforeEach
    void setUp() {
        provider = new MemoryProvider(new DataExtractor(new ObjectMapper()));
    }

    private static SecretStoreDefinition store(MemoryProviderConfig config) {
        return new SecretStoreDefinition("mem", StoreKind.SECRET_STORE, "team-a", ProviderSpec.memory(config));
    }

    @Test
    @DisplayName("Provider metadata: memory tag, read-write")
    void metadata() {
        assertThat(provider.variantTag()).isEqualTo("memory");
        assertThat(provider.capabilities()).isEqualTo(Capabilities.READ_WRITE);
    }

    @Test
    @DisplayName("newClient: Should authenticate with the resolved token and read from the vault")
    void newClient_withToken() throws Exception {
        InMemorySecretVault vault = provider.createVault("v1", "tok");
        vault.write("db", "value".getBytes(StandardCharsets.UTF_8));
        CredentialResolver resolver = (scope, ref) -> {
            assertThat(scope.namespace()).isEqualTo("team-a");
            return "tok";
        };

        try (SecretsClient client = provider.newClient(store(new MemoryProviderConfig("v1", SecretKeySelector.of("creds", "token"))),
                resolver, "team-a")) {
            assertThat(new String(client.getSecret(RemoteRef.of("db")), StandardCharsets.UTF_8)).isEqualTo("value");
        }
    }

    @Test
    @DisplayName("newClient: A wrong or missing token fails with BACKEND_CONNECT")
    void newClient_badToken_throws() {
        provider.createVault("v1", "tok");

        assertThatThrownBy(() -> provider.newClient(store(new MemoryProviderConfig("v1", SecretKeySelector.of("creds", "token"))),
                (scope, ref) -> "wrong", "team-a"))
                .isInstanceOf(BackendConnectException.class);
        assertThatThrownBy(() -> provider.newClient(store(new MemoryProviderConfig("v1", null)),
                (scope, ref) -> "unused", "team-a"))
                .isInstanceOf(BackendConnectException.class);
    }

    @Test
    @DisplayName("newClient: Should reject a store configured for another backend")
    void newClient_wrongVariant_throws() {
        SecretStoreDefinition awsStore = new SecretStoreDefinition("aws", StoreKind.SECRET_STORE, "team-a",
                ProviderSpec.aws(new AwsProviderConfig("eu-west-1", null, null, null)));

        assertThatThrownBy(() -> provider.newClient(awsStore, (scope, ref) -> "", "team-a"))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("createVault: Should reject duplicate vault ids")
    void createVault_duplicate_throws() {
        provider.createVault("v1", null);

        assertThatThrownBy(() -> provider.createVault("v1", null)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("validateConfig: Warns about an open vault and rejects foreign-namespace referents")
    void validateConfig() {
        assertThat(provider.validateConfig(store(new MemoryProviderConfig("v1", null))))
                .singleElement().asString().contains("without an auth token");
        assertThat(provider.validateConfig(store(new MemoryProviderConfig("v1", SecretKeySelector.of("creds", "token")))))
                .isEmpty();
        assertThatThrownBy(() -> provider.validateConfig(store(
                new MemoryProviderConfig("v1", new SecretKeySelector("creds", "token", "team-b")))))
                .isInstanceOf(ConfigurationException.class);
    }
}
