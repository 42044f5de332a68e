package tech.yump.secretsync.store;

import jakarta.validation.Valid;
import org.springframework.lang.Nullable;
import tech.yump.secretsync.config.validation.ValidProviderSpec;
import tech.yump.secretsync.provider.error.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Backend selection of a store. Exactly one variant is set; its field name is the variant tag
 * under which the matching provider is registered.
 */
@ValidProviderSpec
public record ProviderSpec(
        @Valid @Nullable MemoryProviderConfig memory,
        @Valid @Nullable LocalVaultProviderConfig local,
        @Valid @Nullable AwsProviderConfig aws
) {

    public static final String MEMORY = "memory";
    public static final String LOCAL = "local";
    public static final String AWS = "aws";

    public static ProviderSpec memory(MemoryProviderConfig config) {
        return new ProviderSpec(config, null, null);
    }

    public static ProviderSpec local(LocalVaultProviderConfig config) {
        return new ProviderSpec(null, config, null);
    }

    public static ProviderSpec aws(AwsProviderConfig config) {
        return new ProviderSpec(null, null, config);
    }

    /**
     * Names of the variants that are set. Valid specs return exactly one.
     */
    public List<String> configuredVariants() {
        List<String> variants = new ArrayList<>(1);
        if (memory != null) {
            variants.add(MEMORY);
        }
        if (local != null) {
            variants.add(LOCAL);
        }
        if (aws != null) {
            variants.add(AWS);
        }
        return variants;
    }

    /**
     * @throws ConfigurationException unless exactly one variant is set
     */
    public String variantTag() throws ConfigurationException {
        List<String> variants = configuredVariants();
        if (variants.size() != 1) {
            throw new ConfigurationException("Store provider must configure exactly one backend, found: " + variants);
        }
        return variants.get(0);
    }
}
