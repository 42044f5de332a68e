package tech.yump.secretsync.backend.memory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import tech.yump.secretsync.provider.SecretSummary;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A versioned secret vault held in process memory. Every write appends a version numbered from 1;
 * reads without a version return the highest one.
 */
@Slf4j
public class InMemorySecretVault {

    private static final class Entry {
        private final List<byte[]> versions = new ArrayList<>();
        private Map<String, String> tags = Map.of();
    }

    private final String id;
    @Nullable
    private final String authToken;
    private final Map<String, Entry> entries = new TreeMap<>();
    private volatile boolean available = true;

    public InMemorySecretVault(String id, @Nullable String authToken) {
        this.id = id;
        this.authToken = authToken;
    }

    public String getId() {
        return id;
    }

    /**
     * A vault without a token accepts any caller; otherwise the presented token must match.
     */
    public boolean authenticate(@Nullable String token) {
        if (authToken == null) {
            return true;
        }
        return token != null && MessageDigest.isEqual(
                authToken.getBytes(StandardCharsets.UTF_8), token.getBytes(StandardCharsets.UTF_8));
    }

    public boolean isAvailable() {
        return available;
    }

    /**
     * Simulates an outage: while unavailable, clients fail every call.
     */
    public void setAvailable(boolean available) {
        this.available = available;
        log.info("Memory vault '{}' is now {}", id, available ? "available" : "unavailable");
    }

    /**
     * @param version 1-based version, {@code null} for latest
     */
    public synchronized Optional<byte[]> read(String name, @Nullable Integer version) {
        Entry entry = entries.get(name);
        if (entry == null || entry.versions.isEmpty()) {
            return Optional.empty();
        }
        int index = version == null ? entry.versions.size() - 1 : version - 1;
        if (index < 0 || index >= entry.versions.size()) {
            return Optional.empty();
        }
        return Optional.of(entry.versions.get(index).clone());
    }

    /**
     * Appends a new version.
     *
     * @return the number of the version written
     */
    public synchronized int write(String name, byte[] value) {
        Entry entry = entries.computeIfAbsent(name, n -> new Entry());
        entry.versions.add(value.clone());
        return entry.versions.size();
    }

    public synchronized void tag(String name, Map<String, String> tags) {
        Entry entry = entries.computeIfAbsent(name, n -> new Entry());
        entry.tags = Map.copyOf(new HashMap<>(tags));
    }

    public synchronized boolean remove(String name) {
        return entries.remove(name) != null;
    }

    public synchronized List<SecretSummary> list() {
        List<SecretSummary> summaries = new ArrayList<>(entries.size());
        entries.forEach((name, entry) -> {
            if (!entry.versions.isEmpty()) {
                summaries.add(new SecretSummary(name, entry.tags));
            }
        });
        return summaries;
    }
}
