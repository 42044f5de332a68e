package tech.yump.secretsync.scheduler;

import tech.yump.secretsync.provider.ValidationResult;
import tech.yump.secretsync.provider.ValidationStatus;
import tech.yump.secretsync.store.StoreKey;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last validation outcome per store. Writes are last-write-wins; entries older than the TTL read as
 * {@link ValidationResult#UNKNOWN}.
 */
public class StoreHealthCache {

    public record Entry(ValidationStatus status, Instant checkedAt) {}

    private final Map<StoreKey, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public StoreHealthCache(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    public void record(StoreKey store, ValidationStatus status) {
        entries.put(store, new Entry(status, clock.instant()));
    }

    public ValidationResult resultOf(StoreKey store) {
        Entry entry = entries.get(store);
        if (entry == null || isExpired(entry)) {
            return ValidationResult.UNKNOWN;
        }
        return entry.status().result();
    }

    public Optional<Entry> entry(StoreKey store) {
        return Optional.ofNullable(entries.get(store));
    }

    public boolean isExpired(Entry entry) {
        return entry.checkedAt().plus(ttl).isBefore(clock.instant());
    }
}
