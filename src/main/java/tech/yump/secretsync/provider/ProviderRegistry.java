package tech.yump.secretsync.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import tech.yump.secretsync.provider.error.ConfigurationException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Maps a provider variant tag to its {@link Provider}. Populated once during bootstrap through
 * {@link Builder} and immutable afterwards, so lookups need no synchronization.
 */
@Slf4j
public final class ProviderRegistry {

    /**
     * One registered backend.
     */
    public record Registration(String tag, Provider provider, MaintenanceStatus maintenanceStatus) {}

    private final Map<String, Registration> registrations;

    private ProviderRegistry(Map<String, Registration> registrations) {
        this.registrations = Map.copyOf(registrations);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Registration> lookup(String tag) {
        return Optional.ofNullable(registrations.get(tag));
    }

    /**
     * Returns the provider registered under {@code tag}.
     *
     * @throws ConfigurationException if no provider is registered for the tag
     */
    public Provider require(String tag) throws ConfigurationException {
        Registration registration = lookup(tag)
                .orElseThrow(() -> new ConfigurationException("No provider registered for variant '" + tag + "'"));
        if (registration.maintenanceStatus() == MaintenanceStatus.NOT_MAINTAINED) {
            log.warn("Provider '{}' is not maintained anymore, consider migrating to another backend", tag);
        }
        return registration.provider();
    }

    public Set<String> tags() {
        return registrations.keySet();
    }

    public static final class Builder {

        private final Map<String, Registration> registrations = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * @throws IllegalStateException if {@code tag} is already registered
         */
        public Builder register(String tag, Provider provider, MaintenanceStatus maintenanceStatus) {
            if (!StringUtils.hasText(tag)) {
                throw new IllegalArgumentException("Provider variant tag cannot be null or empty.");
            }
            Objects.requireNonNull(provider, "Provider cannot be null.");
            Objects.requireNonNull(maintenanceStatus, "Maintenance status cannot be null.");
            if (registrations.containsKey(tag)) {
                throw new IllegalStateException("Provider for variant '" + tag + "' is already registered");
            }
            registrations.put(tag, new Registration(tag, provider, maintenanceStatus));
            log.info("Registered provider '{}' ({}, {})", tag, provider.capabilities(), maintenanceStatus);
            return this;
        }

        public ProviderRegistry build() {
            return new ProviderRegistry(registrations);
        }
    }
}
