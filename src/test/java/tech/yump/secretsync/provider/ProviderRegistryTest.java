package tech.yump.secretsync.provider;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.yump.secretsync.provider.error.ConfigurationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(MockitoExtension.class)
class ProviderRegistryTest {

    @Mock
    private Provider memoryProvider;

    @Mock
    private Provider legacyProvider;

    @Test
    @DisplayName("lookup: Registered providers are found by tag")
    void lookup_registeredTag() {
        ProviderRegistry registry = ProviderRegistry.builder()
                .register("memory", memoryProvider, MaintenanceStatus.MAINTAINED)
                .register("legacy", legacyProvider, MaintenanceStatus.NOT_MAINTAINED)
                .build();

        assertThat(registry.lookup("memory")).get()
                .extracting(ProviderRegistry.Registration::provider)
                .isSameAs(memoryProvider);
        assertThat(registry.lookup("legacy")).get()
                .extracting(ProviderRegistry.Registration::maintenanceStatus)
                .isEqualTo(MaintenanceStatus.NOT_MAINTAINED);
        assertThat(registry.lookup("aws")).isEmpty();
        assertThat(registry.tags()).containsExactlyInAnyOrder("memory", "legacy");
    }

    @Test
    @DisplayName("register: Should reject a duplicate tag")
    void register_duplicateTag_throws() {
        ProviderRegistry.Builder builder = ProviderRegistry.builder()
                .register("memory", memoryProvider, MaintenanceStatus.MAINTAINED);

        assertThatThrownBy(() -> builder.register("memory", legacyProvider, MaintenanceStatus.MAINTAINED))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Provider for variant 'memory' is already registered");
    }

    @Test
    @DisplayName("register: Should reject a blank tag")
    void register_blankTag_throws() {
        assertThatThrownBy(() -> ProviderRegistry.builder().register(" ", memoryProvider, MaintenanceStatus.MAINTAINED))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("require: Unknown tags fail with a configuration error")
    void require_unknownTag_throws() {
        ProviderRegistry registry = ProviderRegistry.builder().build();

        assertThatThrownBy(() -> registry.require("vault"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("'vault'");
    }
}
