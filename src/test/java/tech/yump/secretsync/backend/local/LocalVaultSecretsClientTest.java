package tech.yump.secretsync.backend.local;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tech.yump.secretsync.provider.DataExtractor;
import tech.yump.secretsync.provider.FindQuery;
import tech.yump.secretsync.provider.PushSpec;
import tech.yump.secretsync.provider.RemoteRef;
import tech.yump.secretsync.provider.ValidationResult;
import tech.yump.secretsync.provider.error.ConfigurationException;
import tech.yump.secretsync.provider.error.InvalidVersionException;
import tech.yump.secretsync.provider.error.MalformedPayloadException;
import tech.yump.secretsync.provider.error.SecretNotFoundException;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalVaultSecretsClientTest {

    @TempDir
    Path vaultDir;

    private ObjectMapper objectMapper;
    private FileSystemVaultStorage storage;
    private LocalVaultSecretsClient client;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        storage = new FileSystemVaultStorage(vaultDir, objectMapper);
        storage.initialize();
        client = newClient(randomKey());
    }

    private LocalVaultSecretsClient newClient(EncryptionService encryptionService) {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
        return new LocalVaultSecretsClient(storage, encryptionService, new DataExtractor(objectMapper), clock);
    }

    private static EncryptionService randomKey() {
        byte[] key = new byte[32];
        new SecureRandom().nextBytes(key);
        return new EncryptionService(new SecretKeySpec(key, "AES"));
    }

    private static byte[] utf8(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static String str(byte[] value) {
        return new String(value, StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("pushSecret: Should store encrypted versions under <name>/versions/<n>.json")
    void pushSecret_writesEncryptedVersions() throws Exception {
        client.pushSecret(new PushSpec("x", "db", null), Map.of("x", utf8("first")));
        client.pushSecret(new PushSpec("x", "db", null), Map.of("x", utf8("second")));

        Path v1 = vaultDir.resolve("db/versions/1.json");
        Path v2 = vaultDir.resolve("db/versions/2.json");
        assertThat(v1).exists();
        assertThat(v2).exists();
        assertThat(Files.readString(v2)).doesNotContain("second").contains("\"v\":1");

        assertThat(str(client.getSecret(RemoteRef.of("db")))).isEqualTo("second");
        assertThat(str(client.getSecret(new RemoteRef("db", "1", null)))).isEqualTo("first");
    }

    @Test
    @DisplayName("getSecret: Versions must be positive integers")
    void getSecret_invalidVersion_throws() {
        client.pushSecret(new PushSpec("x", "db", null), Map.of("x", utf8("v")));

        assertThatThrownBy(() -> client.getSecret(new RemoteRef("db", "0", null))).isInstanceOf(InvalidVersionException.class);
        assertThatThrownBy(() -> client.getSecret(new RemoteRef("db", "latest", null))).isInstanceOf(InvalidVersionException.class);
        assertThatThrownBy(() -> client.getSecret(new RemoteRef("db", "+1", null))).isInstanceOf(InvalidVersionException.class);
        assertThatThrownBy(() -> client.getSecret(new RemoteRef("db", "7", null))).isInstanceOf(SecretNotFoundException.class);
    }

    @Test
    @DisplayName("getSecret: Names outside the vault alphabet are never found")
    void getSecret_invalidName_notFound() {
        assertThatThrownBy(() -> client.getSecret(RemoteRef.of("../etc/passwd"))).isInstanceOf(SecretNotFoundException.class);
        assertThatThrownBy(() -> client.pushSecret(new PushSpec(null, "../escape", null), Map.of()))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("getSecret: Data written under another master key is reported as malformed")
    void getSecret_wrongKey_malformed() {
        client.pushSecret(new PushSpec("x", "db", null), Map.of("x", utf8("v")));
        LocalVaultSecretsClient otherKeyClient = newClient(randomKey());

        assertThatThrownBy(() -> otherKeyClient.getSecret(RemoteRef.of("db")))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("Failed to decrypt secret 'db' version 1");
    }

    @Test
    @DisplayName("getSecret: A version file copied to another secret does not decrypt")
    void getSecret_movedFile_malformed() throws Exception {
        client.pushSecret(new PushSpec("x", "db", null), Map.of("x", utf8("db-value")));
        client.pushSecret(new PushSpec("x", "cache", null), Map.of("x", utf8("cache-value")));

        Files.copy(vaultDir.resolve("db/versions/1.json"), vaultDir.resolve("cache/versions/2.json"));

        assertThatThrownBy(() -> client.getSecret(RemoteRef.of("cache")))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("'cache' version 2");
        assertThat(str(client.getSecret(new RemoteRef("cache", "1", null)))).isEqualTo("cache-value");
    }

    @Test
    @DisplayName("getAllSecrets and deleteSecret: Should list by name and remove every version")
    void findAndDelete() {
        client.pushSecret(new PushSpec(null, "test-a", null), Map.of("k", utf8("a")));
        client.pushSecret(new PushSpec(null, "test-b", null), Map.of("k", utf8("b")));
        client.pushSecret(new PushSpec(null, "prod", null), Map.of("k", utf8("p")));

        Map<String, byte[]> found = client.getAllSecrets(FindQuery.byName("test-.*"));
        assertThat(found).containsOnlyKeys("test-a", "test-b");
        assertThat(str(found.get("test-a"))).isEqualTo("{\"k\":\"a\"}");

        client.deleteSecret("test-a");
        assertThatCode(() -> client.deleteSecret("test-a")).doesNotThrowAnyException();
        assertThat(vaultDir.resolve("test-a")).doesNotExist();
        assertThat(client.secretExists("test-a")).isFalse();
        assertThat(client.secretExists("test-b")).isTrue();
    }

    @Test
    @DisplayName("validate: An initialized vault directory is READY")
    void validate_ready() {
        assertThat(client.validate().result()).isEqualTo(ValidationResult.READY);
    }
}
