package tech.yump.secretsync.sync;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import org.springframework.lang.Nullable;
import tech.yump.secretsync.provider.FindQuery;
import tech.yump.secretsync.provider.RemoteRef;
import tech.yump.secretsync.store.StoreRef;

/**
 * Pulls many keys at once: either the flattened JSON object of one secret ({@code extract}) or
 * every secret matched by a query ({@code find}).
 */
public record DataFromRef(
        @Valid @Nullable StoreRef storeRef,
        @Valid @Nullable RemoteRef extract,
        @Valid @Nullable FindQuery find
) {

    @AssertTrue(message = "Exactly one of dataFrom extract or find must be set.")
    public boolean isSourceValid() {
        return (extract == null) != (find == null);
    }
}
