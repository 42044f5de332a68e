package tech.yump.secretsync.provider;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

/**
 * Identifies one secret value in a backend.
 *
 * @param key      backend-unique secret name
 * @param version  backend-defined version token; empty means latest
 * @param property top-level field of a JSON payload to return instead of the whole value
 */
@Builder
public record RemoteRef(
        @NotBlank(message = "Remote reference key must be provided.")
        String key,
        @Nullable String version,
        @Nullable String property
) {

    public static RemoteRef of(String key) {
        return new RemoteRef(key, null, null);
    }

    public boolean hasVersion() {
        return StringUtils.hasText(version);
    }

    public boolean hasProperty() {
        return StringUtils.hasText(property);
    }
}
