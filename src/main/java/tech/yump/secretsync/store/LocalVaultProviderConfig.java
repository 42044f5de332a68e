package tech.yump.secretsync.store;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Configuration of the encrypted local filesystem vault backend.
 *
 * @param path      base directory holding all vaults
 * @param vaultId   sub-directory of this vault
 * @param masterKey Base64 encoded AES-256 key
 */
public record LocalVaultProviderConfig(
        @NotBlank(message = "Local vault path (provider.local.path) must be provided.")
        String path,
        @NotBlank(message = "Local vault id (provider.local.vault-id) must be provided.")
        String vaultId,
        @Valid
        @NotNull(message = "Local vault master key reference (provider.local.master-key) must be provided.")
        SecretKeySelector masterKey
) {}
