package tech.yump.secretsync.sync;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.lang.Nullable;
import tech.yump.secretsync.provider.RemoteRef;
import tech.yump.secretsync.store.StoreRef;

/**
 * Pulls one remote value into {@code secretKey} of the target secret.
 *
 * @param storeRef overrides the definition's store
 */
public record DataRef(
        @NotBlank(message = "Data secret key must be provided.")
        String secretKey,
        @Valid @Nullable StoreRef storeRef,
        @Valid
        @NotNull(message = "Data remote reference must be provided.")
        RemoteRef remoteRef
) {}
