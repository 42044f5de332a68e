package tech.yump.secretsync.provider;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.yump.secretsync.provider.error.ConfigurationException;
import tech.yump.secretsync.store.MemoryProviderConfig;
import tech.yump.secretsync.store.ProviderSpec;
import tech.yump.secretsync.store.SecretKeySelector;
import tech.yump.secretsync.store.SecretStoreDefinition;
import tech.yump.secretsync.store.StoreKind;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StoreValidationTest {

    private static final MemoryProviderConfig MEMORY_CONFIG = new MemoryProviderConfig("v1", null);

    @Test
    @DisplayName("requireVariant: Should return the variant config when present")
    void requireVariant_present() {
        SecretStoreDefinition store = new SecretStoreDefinition("s", StoreKind.SECRET_STORE, "team-a",
                ProviderSpec.memory(MEMORY_CONFIG));

        MemoryProviderConfig config = StoreValidation.requireVariant(store, "memory", s -> s.provider().memory());

        assertThat(config).isSameAs(MEMORY_CONFIG);
    }

    @Test
    @DisplayName("requireVariant: Should fail for a null store, a missing provider or another variant")
    void requireVariant_invalid_throws() {
        SecretStoreDefinition noProvider = new SecretStoreDefinition("s", StoreKind.SECRET_STORE, "team-a", null);
        SecretStoreDefinition memoryStore = new SecretStoreDefinition("s", StoreKind.SECRET_STORE, "team-a",
                ProviderSpec.memory(MEMORY_CONFIG));

        assertThatThrownBy(() -> StoreValidation.requireVariant(null, "memory", s -> s.provider().memory()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("Found null store definition");
        assertThatThrownBy(() -> StoreValidation.requireVariant(noProvider, "memory", s -> s.provider().memory()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("missing a provider");
        assertThatThrownBy(() -> StoreValidation.requireVariant(memoryStore, "aws", s -> s.provider().aws()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("missing 'aws' configuration");
    }

    @Test
    @DisplayName("validateReferent: Namespaced stores may only reference their own namespace")
    void validateReferent_namespacedStore() {
        SecretStoreDefinition store = new SecretStoreDefinition("s", StoreKind.SECRET_STORE, "team-a",
                ProviderSpec.memory(MEMORY_CONFIG));

        assertThatCode(() -> StoreValidation.validateReferent(store, SecretKeySelector.of("creds", "token"), "authToken"))
                .doesNotThrowAnyException();
        assertThatCode(() -> StoreValidation.validateReferent(store, new SecretKeySelector("creds", "token", "team-a"), "authToken"))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> StoreValidation.validateReferent(store, new SecretKeySelector("creds", "token", "team-b"), "authToken"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Invalid authToken");
    }

    @Test
    @DisplayName("validateReferent: Cluster stores may reference any namespace")
    void validateReferent_clusterStore() {
        SecretStoreDefinition store = new SecretStoreDefinition("s", StoreKind.CLUSTER_SECRET_STORE, null,
                ProviderSpec.memory(MEMORY_CONFIG));

        assertThatCode(() -> StoreValidation.validateReferent(store, new SecretKeySelector("creds", "token", "team-b"), "authToken"))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("validateReferent: Cluster stores must name the namespace of their credentials")
    void validateReferent_clusterStoreWithoutNamespace_throws() {
        SecretStoreDefinition store = new SecretStoreDefinition("s", StoreKind.CLUSTER_SECRET_STORE, null,
                ProviderSpec.memory(MEMORY_CONFIG));

        assertThatThrownBy(() -> StoreValidation.validateReferent(store, SecretKeySelector.of("creds", "token"), "authToken"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Invalid authToken")
                .hasMessageContaining("creds[token]");
    }
}
