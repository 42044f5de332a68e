package tech.yump.secretsync.backend.aws;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.CreateSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.DeleteSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.DescribeSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.ListSecretsRequest;
import software.amazon.awssdk.services.secretsmanager.model.ListSecretsResponse;
import software.amazon.awssdk.services.secretsmanager.model.PutSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.ResourceExistsException;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;
import software.amazon.awssdk.services.secretsmanager.model.SecretListEntry;
import software.amazon.awssdk.services.secretsmanager.model.Tag;
import tech.yump.secretsync.provider.AbstractSecretsClient;
import tech.yump.secretsync.provider.DataExtractor;
import tech.yump.secretsync.provider.SecretSummary;
import tech.yump.secretsync.provider.ValidationStatus;
import tech.yump.secretsync.provider.error.BackendException;
import tech.yump.secretsync.provider.error.InvalidVersionException;
import tech.yump.secretsync.provider.error.SecretNotFoundException;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Client of AWS Secrets Manager.
 *
 * <p>Versions are either {@code uuid/<versionId>} or a staging label such as {@code AWSCURRENT}.
 * Values that are valid UTF-8 are written as {@code SecretString}, anything else as {@code SecretBinary}.
 */
@Slf4j
public class AwsSecretsManagerSecretsClient extends AbstractSecretsClient<AwsSecretsManagerSecretsClient.VersionSelector> {

    static final String VERSION_ID_PREFIX = "uuid/";

    /**
     * Exactly one of the two fields is set.
     */
    record VersionSelector(@Nullable String versionId, @Nullable String versionStage) {}

    private final SecretsManagerClient client;

    public AwsSecretsManagerSecretsClient(SecretsManagerClient client, DataExtractor dataExtractor) {
        super(dataExtractor);
        this.client = client;
    }

    @Override
    protected VersionSelector parseVersion(String version) throws InvalidVersionException {
        if (version.startsWith(VERSION_ID_PREFIX)) {
            String versionId = version.substring(VERSION_ID_PREFIX.length());
            if (versionId.isBlank()) {
                throw new InvalidVersionException("Invalid version '" + version + "': missing version id");
            }
            return new VersionSelector(versionId, null);
        }
        if (version.isBlank() || version.contains("/")) {
            throw new InvalidVersionException("Invalid version '" + version + "': expected a staging label or uuid/<versionId>");
        }
        return new VersionSelector(null, version);
    }

    @Override
    protected byte[] readValue(String key, @Nullable VersionSelector version) {
        GetSecretValueRequest.Builder request = GetSecretValueRequest.builder().secretId(key);
        if (version != null) {
            request.versionId(version.versionId()).versionStage(version.versionStage());
        }
        try {
            GetSecretValueResponse response = client.getSecretValue(request.build());
            if (response.secretString() != null) {
                return response.secretString().getBytes(StandardCharsets.UTF_8);
            }
            if (response.secretBinary() != null) {
                return response.secretBinary().asByteArray();
            }
            throw new SecretNotFoundException("Secret '" + key + "' has no value");
        } catch (ResourceNotFoundException e) {
            throw new SecretNotFoundException("Secret '" + key + "' not found in AWS Secrets Manager", e);
        } catch (SdkException e) {
            log.error("Failed to read secret '{}' from AWS Secrets Manager: {}", key, e.getMessage());
            throw new BackendException("Failed to read secret '" + key + "': " + e.getMessage(), e);
        }
    }

    @Override
    protected Optional<byte[]> findLatest(String key) {
        try {
            return Optional.of(readValue(key, null));
        } catch (SecretNotFoundException e) {
            return Optional.empty();
        }
    }

    @Override
    protected List<SecretSummary> listSecrets() {
        List<SecretSummary> secrets = new ArrayList<>();
        String nextToken = null;
        try {
            do {
                ListSecretsResponse response = client.listSecrets(ListSecretsRequest.builder().nextToken(nextToken).build());
                for (SecretListEntry entry : response.secretList()) {
                    secrets.add(new SecretSummary(entry.name(), tagsOf(entry)));
                }
                nextToken = response.nextToken();
            } while (nextToken != null);
        } catch (SdkException e) {
            log.error("Failed to list secrets in AWS Secrets Manager: {}", e.getMessage());
            throw new BackendException("Failed to list secrets: " + e.getMessage(), e);
        }
        return secrets;
    }

    @Override
    protected void writeValue(String key, byte[] value, boolean exists) {
        Optional<String> text = asUtf8(value);
        try {
            if (exists) {
                putValue(key, value, text);
            } else {
                CreateSecretRequest.Builder request = CreateSecretRequest.builder().name(key);
                text.ifPresentOrElse(request::secretString, () -> request.secretBinary(SdkBytes.fromByteArray(value)));
                try {
                    client.createSecret(request.build());
                } catch (ResourceExistsException e) {
                    // created concurrently since the existence check
                    log.debug("Secret '{}' appeared before creation, updating its value instead", key);
                    putValue(key, value, text);
                }
            }
        } catch (SdkException e) {
            log.error("Failed to write secret '{}' to AWS Secrets Manager: {}", key, e.getMessage());
            throw new BackendException("Failed to write secret '" + key + "': " + e.getMessage(), e);
        }
    }

    private void putValue(String key, byte[] value, Optional<String> text) {
        PutSecretValueRequest.Builder request = PutSecretValueRequest.builder().secretId(key);
        text.ifPresentOrElse(request::secretString, () -> request.secretBinary(SdkBytes.fromByteArray(value)));
        client.putSecretValue(request.build());
    }

    @Override
    protected boolean removeValue(String key) {
        try {
            client.deleteSecret(DeleteSecretRequest.builder().secretId(key).forceDeleteWithoutRecovery(true).build());
            return true;
        } catch (ResourceNotFoundException e) {
            return false;
        } catch (SdkException e) {
            log.error("Failed to delete secret '{}' from AWS Secrets Manager: {}", key, e.getMessage());
            throw new BackendException("Failed to delete secret '" + key + "': " + e.getMessage(), e);
        }
    }

    @Override
    public boolean secretExists(String remoteKey) {
        try {
            client.describeSecret(DescribeSecretRequest.builder().secretId(remoteKey).build());
            return true;
        } catch (ResourceNotFoundException e) {
            return false;
        } catch (SdkException e) {
            throw new BackendException("Failed to describe secret '" + remoteKey + "': " + e.getMessage(), e);
        }
    }

    @Override
    public ValidationStatus validate() {
        try {
            client.listSecrets(ListSecretsRequest.builder().maxResults(1).build());
            return ValidationStatus.ready();
        } catch (SdkException e) {
            log.warn("AWS Secrets Manager validation failed: {}", e.getMessage());
            return ValidationStatus.error(new BackendException("Failed to validate client: " + e.getMessage(), e));
        }
    }

    @Override
    public void close() {
        client.close();
    }

    private static Map<String, String> tagsOf(SecretListEntry entry) {
        Map<String, String> tags = new HashMap<>();
        if (entry.hasTags()) {
            for (Tag tag : entry.tags()) {
                tags.put(tag.key(), tag.value() == null ? "" : tag.value());
            }
        }
        return tags;
    }

    private static Optional<String> asUtf8(byte[] value) {
        try {
            return Optional.of(StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(value))
                    .toString());
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
    }
}
