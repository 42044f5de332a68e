package tech.yump.secretsync.store;

import jakarta.validation.constraints.NotBlank;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

/**
 * Points at one key of a cluster secret holding a credential. The plaintext is resolved right before
 * client construction and never stored.
 *
 * @param name      cluster secret name
 * @param key       key within the secret
 * @param namespace namespace of the secret; defaults to the namespace of the requesting object
 */
public record SecretKeySelector(
        @NotBlank(message = "Credential reference name must be provided.")
        String name,
        @NotBlank(message = "Credential reference key must be provided.")
        String key,
        @Nullable String namespace
) {

    public static SecretKeySelector of(String name, String key) {
        return new SecretKeySelector(name, key, null);
    }

    public boolean hasNamespace() {
        return StringUtils.hasText(namespace);
    }

    @Override
    public String toString() {
        return (hasNamespace() ? namespace + "/" : "") + name + "[" + key + "]";
    }
}
