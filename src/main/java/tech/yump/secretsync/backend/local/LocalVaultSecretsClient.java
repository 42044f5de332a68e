package tech.yump.secretsync.backend.local;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import tech.yump.secretsync.provider.AbstractSecretsClient;
import tech.yump.secretsync.provider.DataExtractor;
import tech.yump.secretsync.provider.SecretSummary;
import tech.yump.secretsync.provider.error.BackendException;
import tech.yump.secretsync.provider.error.ConfigurationException;
import tech.yump.secretsync.provider.error.InvalidVersionException;
import tech.yump.secretsync.provider.error.MalformedPayloadException;
import tech.yump.secretsync.provider.error.SecretNotFoundException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Client of an encrypted local vault. Each secret is a directory holding one encrypted file per
 * version: {@code <name>/versions/<n>.json}, numbered from 1. Each file is sealed to its own
 * name and version.
 */
@Slf4j
public class LocalVaultSecretsClient extends AbstractSecretsClient<Integer> {

    static final Pattern SECRET_NAME_PATTERN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]*$");
    private static final Pattern VERSION_FILE_PATTERN = Pattern.compile("^(\\d+)\\.json$");
    private static final String VERSIONS_SUBDIR = "versions";
    private static final int MAX_WRITE_ATTEMPTS = 5;

    private final FileSystemVaultStorage storage;
    private final EncryptionService encryptionService;
    private final Clock clock;

    public LocalVaultSecretsClient(FileSystemVaultStorage storage, EncryptionService encryptionService,
                                   DataExtractor dataExtractor, Clock clock) {
        super(dataExtractor);
        this.storage = storage;
        this.encryptionService = encryptionService;
        this.clock = clock;
    }

    @Override
    protected Integer parseVersion(String version) throws InvalidVersionException {
        int parsed;
        try {
            parsed = version.startsWith("+") ? 0 : Integer.parseInt(version);
        } catch (NumberFormatException e) {
            throw new InvalidVersionException("Invalid version '" + version + "': expected a positive integer", e);
        }
        if (parsed < 1) {
            throw new InvalidVersionException("Invalid version '" + version + "': expected a positive integer");
        }
        return parsed;
    }

    @Override
    protected byte[] readValue(String key, @Nullable Integer version) {
        if (!isValidName(key)) {
            throw new SecretNotFoundException("Secret '" + key + "' not found: not a valid local vault name");
        }
        int resolved = version != null ? version : latestVersion(key)
                .orElseThrow(() -> new SecretNotFoundException("Secret '" + key + "' not found in " + storage.getBasePath()));
        EncryptedData data = storage.get(versionKey(key, resolved))
                .orElseThrow(() -> new SecretNotFoundException("Secret '" + key + "' version " + resolved + " not found"));
        return decrypt(key, resolved, data);
    }

    @Override
    protected Optional<byte[]> findLatest(String key) {
        if (!isValidName(key)) {
            return Optional.empty();
        }
        OptionalInt latest = latestVersion(key);
        if (latest.isEmpty()) {
            return Optional.empty();
        }
        return storage.get(versionKey(key, latest.getAsInt())).map(data -> decrypt(key, latest.getAsInt(), data));
    }

    @Override
    protected List<SecretSummary> listSecrets() {
        List<SecretSummary> secrets = new ArrayList<>();
        for (String name : storage.listDirectory("")) {
            if (isValidName(name) && latestVersion(name).isPresent()) {
                secrets.add(SecretSummary.named(name));
            }
        }
        return secrets;
    }

    @Override
    protected void writeValue(String key, byte[] value, boolean exists) {
        if (!isValidName(key)) {
            throw new ConfigurationException("Invalid local vault secret name '" + key + "': must match " + SECRET_NAME_PATTERN.pattern());
        }
        // A concurrent writer may claim the same version number; retry with the next one.
        for (int attempt = 0; attempt < MAX_WRITE_ATTEMPTS; attempt++) {
            int next = latestVersion(key).orElse(0) + 1;
            EncryptedData data = EncryptedData.of(seal(key, next, value), clock.instant());
            if (storage.create(versionKey(key, next), data)) {
                log.debug("Wrote secret '{}' version {}", key, next);
                return;
            }
        }
        throw new BackendException("Failed to claim a new version for secret '" + key + "' after " + MAX_WRITE_ATTEMPTS + " attempts");
    }

    @Override
    protected boolean removeValue(String key) {
        if (!isValidName(key)) {
            return false;
        }
        return storage.deleteTree(key);
    }

    private OptionalInt latestVersion(String name) {
        return storage.listDirectory(name + "/" + VERSIONS_SUBDIR).stream()
                .map(VERSION_FILE_PATTERN::matcher)
                .filter(Matcher::matches)
                .mapToInt(m -> Integer.parseInt(m.group(1)))
                .max();
    }

    private byte[] decrypt(String key, int version, EncryptedData data) {
        try {
            return encryptionService.open(data.toSealed(), versionKey(key, version));
        } catch (EncryptionService.EncryptionException | IllegalArgumentException | IllegalStateException e) {
            log.error("Failed to decrypt secret '{}' version {}: {}", key, version, e.getMessage());
            throw new MalformedPayloadException("Failed to decrypt secret '" + key + "' version " + version, e);
        }
    }

    private EncryptionService.Sealed seal(String key, int version, byte[] value) {
        try {
            return encryptionService.seal(value, versionKey(key, version));
        } catch (EncryptionService.EncryptionException e) {
            throw new BackendException("Failed to encrypt secret '" + key + "'", e);
        }
    }

    private static String versionKey(String name, int version) {
        return name + "/" + VERSIONS_SUBDIR + "/" + version;
    }

    private static boolean isValidName(String name) {
        return SECRET_NAME_PATTERN.matcher(name).matches();
    }
}
