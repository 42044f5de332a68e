package tech.yump.secretsync.sync;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.lang.Nullable;
import tech.yump.secretsync.provider.PushSpec;
import tech.yump.secretsync.store.StoreRef;

/**
 * Pushes data of the definition's source secret to a backend.
 */
public record PushRef(
        @Valid @Nullable StoreRef storeRef,
        @Valid
        @NotNull(message = "Push spec must be provided.")
        PushSpec spec
) {}
