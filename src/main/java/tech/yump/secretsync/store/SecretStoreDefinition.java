package tech.yump.secretsync.store;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

/**
 * A configured store: which backend to talk to and with which credentials.
 */
public record SecretStoreDefinition(
        @NotBlank(message = "Store name must be provided.")
        String name,
        StoreKind kind,
        @Nullable String namespace,
        @Valid
        @NotNull(message = "Store provider must be provided.")
        ProviderSpec provider
) {

    public SecretStoreDefinition {
        if (kind == null) {
            kind = StoreKind.SECRET_STORE;
        }
    }

    @AssertTrue(message = "A SECRET_STORE must declare a namespace and a CLUSTER_SECRET_STORE must not.")
    public boolean isScopeValid() {
        return (kind == StoreKind.SECRET_STORE) == StringUtils.hasText(namespace);
    }

    public StoreKey key() {
        return new StoreKey(kind, kind == StoreKind.CLUSTER_SECRET_STORE ? null : namespace, name);
    }
}
