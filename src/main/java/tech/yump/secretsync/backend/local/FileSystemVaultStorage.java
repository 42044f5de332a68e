package tech.yump.secretsync.backend.local;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Stores {@link EncryptedData} documents as JSON files below one base directory. Keys are relative
 * paths without extension; {@code ".json"} is appended on disk.
 */
@Slf4j
public class FileSystemVaultStorage {

    private final Path basePath;
    private final ObjectMapper objectMapper;

    public FileSystemVaultStorage(Path basePath, ObjectMapper objectMapper) {
        this.basePath = basePath.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
    }

    public Path getBasePath() {
        return basePath;
    }

    /**
     * Creates the base directory if needed and checks it is a readable, writable directory.
     */
    public void initialize() throws StorageException {
        try {
            if (Files.exists(basePath)) {
                if (!Files.isDirectory(basePath)) {
                    throw new StorageException("Vault path exists but is not a directory: " + basePath);
                }
                if (!Files.isReadable(basePath) || !Files.isWritable(basePath)) {
                    throw new StorageException("Vault directory lacks read/write permissions: " + basePath);
                }
            } else {
                Files.createDirectories(basePath);
                log.info("Created vault directory: {}", basePath);
            }
        } catch (IOException e) {
            log.error("Failed to validate or create vault directory: {}", basePath, e);
            throw new StorageException("Failed to initialize vault directory: " + basePath, e);
        }
    }

    /**
     * Writes {@code data} under {@code key} unless a document already exists there.
     *
     * @return false if the key was already taken
     */
    public boolean create(String key, EncryptedData data) throws StorageException {
        if (data == null) {
            throw new IllegalArgumentException("Data cannot be null for create operation.");
        }
        Path filePath = resolveFilePath(key);
        try {
            Files.createDirectories(filePath.getParent());
            try (OutputStream out = Files.newOutputStream(filePath, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                objectMapper.writeValue(out, data);
            }
            log.debug("Stored document '{}'", key);
            return true;
        } catch (FileAlreadyExistsException e) {
            log.debug("Document '{}' already exists", key);
            return false;
        } catch (IOException e) {
            log.error("Failed to write document '{}' at {}: {}", key, filePath, e.getMessage(), e);
            throw new StorageException("Failed to write data for key: " + key, e);
        }
    }

    public Optional<EncryptedData> get(String key) throws StorageException {
        Path filePath = resolveFilePath(key);
        if (!Files.isRegularFile(filePath)) {
            return Optional.empty();
        }
        try (InputStream in = Files.newInputStream(filePath, StandardOpenOption.READ)) {
            return Optional.of(objectMapper.readValue(in, EncryptedData.class));
        } catch (NoSuchFileException e) {
            log.debug("Document '{}' vanished before it could be read", key);
            return Optional.empty();
        } catch (IOException e) {
            log.error("Failed to read document '{}' from {}: {}", key, filePath, e.getMessage(), e);
            throw new StorageException("Failed to read or parse data for key: " + key, e);
        }
    }

    /**
     * Lists entry names of a directory; an empty path lists the base directory. A missing directory
     * yields an empty list.
     */
    public List<String> listDirectory(String relativeDirPath) throws StorageException {
        Path dirPath = relativeDirPath.isEmpty() ? basePath : resolvePath(relativeDirPath);
        if (!Files.isDirectory(dirPath, LinkOption.NOFOLLOW_LINKS)) {
            return List.of();
        }
        List<String> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dirPath)) {
            for (Path entry : stream) {
                entries.add(entry.getFileName().toString());
            }
            return entries;
        } catch (IOException e) {
            log.error("Failed to list directory {}: {}", dirPath, e.getMessage(), e);
            throw new StorageException("Failed to list directory: " + relativeDirPath, e);
        }
    }

    /**
     * Recursively deletes a directory.
     *
     * @return false if it did not exist
     */
    public boolean deleteTree(String relativeDirPath) throws StorageException {
        Path dirPath = resolvePath(relativeDirPath);
        if (!Files.exists(dirPath, LinkOption.NOFOLLOW_LINKS)) {
            return false;
        }
        try (Stream<Path> walk = Files.walk(dirPath)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path path : paths) {
                Files.deleteIfExists(path);
            }
            return true;
        } catch (IOException e) {
            log.error("Failed to delete directory {}: {}", dirPath, e.getMessage(), e);
            throw new StorageException("Failed to delete: " + relativeDirPath, e);
        }
    }

    /**
     * Resolves a relative path against the base directory, rejecting anything that escapes it.
     */
    private Path resolvePath(String relativePath) throws StorageException {
        if (!StringUtils.hasText(relativePath)) {
            throw new IllegalArgumentException("Relative path cannot be null or empty.");
        }
        String sanitizedPath = relativePath.replace('\\', '/').trim();
        if (sanitizedPath.startsWith("/") || sanitizedPath.endsWith("/") || sanitizedPath.contains("..")) {
            log.error("Invalid storage path provided: '{}'", relativePath);
            throw new StorageException("Invalid storage path format: " + relativePath);
        }
        Path absolutePath = basePath.resolve(sanitizedPath).normalize();
        if (!absolutePath.startsWith(basePath)) {
            log.error("Path '{}' resolves to '{}' outside of vault directory '{}'", relativePath, absolutePath, basePath);
            throw new StorageException("Invalid path resulting in path traversal attempt: " + relativePath);
        }
        return absolutePath;
    }

    private Path resolveFilePath(String key) throws StorageException {
        return resolvePath(key + ".json");
    }
}
