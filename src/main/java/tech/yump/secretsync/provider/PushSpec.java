package tech.yump.secretsync.provider;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

/**
 * Describes one push of cluster secret data to a backend.
 *
 * @param sourceKey key of the source secret to push; when absent the whole source secret is pushed as JSON
 * @param remoteKey name of the secret in the backend
 * @param property  field of the remote JSON object to set instead of replacing the whole value
 */
@Builder
public record PushSpec(
        @Nullable String sourceKey,
        @NotBlank(message = "Push remote key must be provided.")
        String remoteKey,
        @Nullable String property
) {

    public boolean hasSourceKey() {
        return StringUtils.hasText(sourceKey);
    }

    public boolean hasProperty() {
        return StringUtils.hasText(property);
    }
}
