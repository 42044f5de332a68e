package tech.yump.secretsync.backend.aws;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClientBuilder;
import tech.yump.secretsync.provider.Capabilities;
import tech.yump.secretsync.provider.CredentialResolver;
import tech.yump.secretsync.provider.CredentialScope;
import tech.yump.secretsync.provider.DataExtractor;
import tech.yump.secretsync.provider.Provider;
import tech.yump.secretsync.provider.SecretsClient;
import tech.yump.secretsync.provider.StoreValidation;
import tech.yump.secretsync.provider.error.BackendConnectException;
import tech.yump.secretsync.provider.error.ConfigurationException;
import tech.yump.secretsync.store.AwsProviderConfig;
import tech.yump.secretsync.store.ProviderSpec;
import tech.yump.secretsync.store.SecretStoreDefinition;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

/**
 * Provider of the {@code aws} backend (AWS Secrets Manager).
 */
@Slf4j
public class AwsSecretsManagerProvider implements Provider {

    private final DataExtractor dataExtractor;

    public AwsSecretsManagerProvider(DataExtractor dataExtractor) {
        this.dataExtractor = dataExtractor;
    }

    @Override
    public String variantTag() {
        return ProviderSpec.AWS;
    }

    @Override
    public Capabilities capabilities() {
        return Capabilities.READ_WRITE;
    }

    @Override
    public SecretsClient newClient(SecretStoreDefinition store, CredentialResolver resolver, String namespace) {
        AwsProviderConfig config = StoreValidation.requireVariant(store, ProviderSpec.AWS, s -> s.provider().aws());
        AwsCredentialsProvider credentials = credentialsProvider(config, StoreValidation.scopeOf(store, namespace), resolver);

        SecretsManagerClientBuilder builder = SecretsManagerClient.builder()
                .region(Region.of(config.region()))
                .credentialsProvider(credentials);
        if (StringUtils.hasText(config.endpoint())) {
            builder.endpointOverride(endpointUri(store, config.endpoint()));
        }
        try {
            return new AwsSecretsManagerSecretsClient(builder.build(), dataExtractor);
        } catch (SdkException e) {
            log.error("Failed to create AWS Secrets Manager client for store {}: {}", store.key(), e.getMessage());
            throw new BackendConnectException("Failed to create AWS Secrets Manager client for store " + store.key(), e);
        }
    }

    @Override
    public List<String> validateConfig(SecretStoreDefinition store) throws ConfigurationException {
        AwsProviderConfig config = StoreValidation.requireVariant(store, ProviderSpec.AWS, s -> s.provider().aws());
        if (!StringUtils.hasText(config.region())) {
            throw new ConfigurationException("Store " + store.key() + ": AWS region must be provided");
        }
        if (!config.isCredentialPairValid()) {
            throw new ConfigurationException("Store " + store.key()
                    + ": AWS access key id and secret access key references must be set together");
        }
        if (StringUtils.hasText(config.endpoint())) {
            endpointUri(store, config.endpoint());
        }
        StoreValidation.validateReferent(store, config.accessKeyId(), "accessKeyId");
        StoreValidation.validateReferent(store, config.secretAccessKey(), "secretAccessKey");

        List<String> warnings = new ArrayList<>();
        if (!config.hasStaticCredentials()) {
            warnings.add("Store " + store.key() + " uses the default AWS credentials chain");
        }
        return warnings;
    }

    private AwsCredentialsProvider credentialsProvider(AwsProviderConfig config, CredentialScope scope, CredentialResolver resolver) {
        if (!config.hasStaticCredentials()) {
            return DefaultCredentialsProvider.create();
        }
        String accessKeyId = resolver.resolve(scope, config.accessKeyId());
        String secretAccessKey = resolver.resolve(scope, config.secretAccessKey());
        return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKeyId, secretAccessKey));
    }

    private static URI endpointUri(SecretStoreDefinition store, String endpoint) {
        try {
            URI uri = new URI(endpoint);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new ConfigurationException("Store " + store.key() + ": AWS endpoint '" + endpoint + "' must be an absolute URL");
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Store " + store.key() + ": invalid AWS endpoint '" + endpoint + "'", e);
        }
    }
}
