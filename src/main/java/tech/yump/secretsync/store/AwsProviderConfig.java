package tech.yump.secretsync.store;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import org.springframework.lang.Nullable;

/**
 * Configuration of the AWS Secrets Manager backend. Without credential references the SDK default
 * credentials chain is used.
 */
public record AwsProviderConfig(
        @NotBlank(message = "AWS region (provider.aws.region) must be provided.")
        String region,
        @Nullable String endpoint,
        @Valid @Nullable SecretKeySelector accessKeyId,
        @Valid @Nullable SecretKeySelector secretAccessKey
) {

    @AssertTrue(message = "AWS access key id and secret access key references must be set together.")
    public boolean isCredentialPairValid() {
        return (accessKeyId == null) == (secretAccessKey == null);
    }

    public boolean hasStaticCredentials() {
        return accessKeyId != null && secretAccessKey != null;
    }
}
