package tech.yump.secretsync.backend.local;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tech.yump.secretsync.provider.CredentialResolver;
import tech.yump.secretsync.provider.DataExtractor;
import tech.yump.secretsync.provider.PushSpec;
import tech.yump.secretsync.provider.RemoteRef;
import tech.yump.secretsync.provider.SecretsClient;
import tech.yump.secretsync.provider.error.ConfigurationException;
import tech.yump.secretsync.store.LocalVaultProviderConfig;
import tech.yump.secretsync.store.ProviderSpec;
import tech.yump.secretsync.store.SecretKeySelector;
import tech.yump.secretsync.store.SecretStoreDefinition;
import tech.yump.secretsync.store.StoreKind;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Base64;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalVaultProviderTest {

    private static final String MASTER_KEY = Base64.getEncoder().encodeToString(new byte[32]);

    @TempDir
    Path baseDir;

    private LocalVaultProvider provider;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        provider = new LocalVaultProvider(objectMapper, new DataExtractor(objectMapper), Clock.systemUTC());
    }

    private SecretStoreDefinition store(String vaultId) {
        return new SecretStoreDefinition("local", StoreKind.SECRET_STORE, "team-a", ProviderSpec.local(
                new LocalVaultProviderConfig(baseDir.toString(), vaultId, SecretKeySelector.of("vault-key", "key"))));
    }

    @Test
    @DisplayName("newClient: Should create the vault directory and share data between clients")
    void newClient_opensVault() throws Exception {
        CredentialResolver resolver = (scope, ref) -> MASTER_KEY;

        try (SecretsClient writer = provider.newClient(store("main"), resolver, "team-a")) {
            writer.pushSecret(new PushSpec("x", "db", null), Map.of("x", "pw".getBytes(StandardCharsets.UTF_8)));
        }
        assertThat(baseDir.resolve("main")).isDirectory();

        try (SecretsClient reader = provider.newClient(store("main"), resolver, "team-a")) {
            assertThat(new String(reader.getSecret(RemoteRef.of("db")), StandardCharsets.UTF_8)).isEqualTo("pw");
        }
    }

    @Test
    @DisplayName("newClient: A master key of the wrong size is a configuration error")
    void newClient_badMasterKey_throws() {
        String shortKey = Base64.getEncoder().encodeToString(new byte[8]);

        assertThatThrownBy(() -> provider.newClient(store("main"), (scope, ref) -> shortKey, "team-a"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("invalid master key");
    }

    @Test
    @DisplayName("validateConfig: Should reject vault ids that would escape the base path")
    void validateConfig_badVaultId_throws() {
        assertThat(provider.validateConfig(store("main"))).isEmpty();
        assertThatThrownBy(() -> provider.validateConfig(store("../other")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("invalid local vault id");
    }
}
