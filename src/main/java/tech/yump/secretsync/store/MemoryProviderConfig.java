package tech.yump.secretsync.store;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.lang.Nullable;

/**
 * Configuration of the in-process memory backend.
 *
 * @param vaultId   vault to bind to
 * @param authToken credential checked against the vault's token, if the vault has one
 */
public record MemoryProviderConfig(
        @NotBlank(message = "Memory provider vault id (provider.memory.vault-id) must be provided.")
        String vaultId,
        @Valid @Nullable SecretKeySelector authToken
) {}
