package transit.sentinel.enrichment.weather;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded cache with per-entry time-to-live. Past {@code maxEntries} the least recently used entry is
 * evicted; an entry older than the TTL is never returned.
 */
public final class TtlCache<K, V> {

    private final int maxEntries;
    private final Duration ttl;
    private final Clock clock;
    private final LinkedHashMap<K, Slot<V>> entries;
    private long hits;
    private long misses;

    public TtlCache(int maxEntries, Duration ttl, Clock clock) {
        if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
        if (ttl.isZero() || ttl.isNegative()) throw new IllegalArgumentException("ttl must be > 0");
        this.maxEntries = maxEntries;
        this.ttl = ttl;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, Slot<V>> eldest) {
                return size() > TtlCache.this.maxEntries;
            }
        };
    }

    public synchronized Optional<V> get(K key) {
        Slot<V> e = entries.get(key);
        if (e == null) {
            misses++;
            return Optional.empty();
        }
        if (isExpired(e, clock.instant())) {
            entries.remove(key);
            misses++;
            return Optional.empty();
        }
        hits++;
        return Optional.of(e.value());
    }

    public synchronized void put(K key, V value) {
        entries.put(Objects.requireNonNull(key, "key"), new Slot<>(Objects.requireNonNull(value, "value"), clock.instant()));
    }

    /**
     * @return number of entries removed
     */
    public synchronized int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Iterator<Slot<V>> it = entries.values().iterator(); it.hasNext(); ) {
            if (isExpired(it.next(), now)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public synchronized Stats stats() {
        Instant now = clock.instant();
        int live = (int) entries.values().stream().filter(e -> !isExpired(e, now)).count();
        return new Stats(entries.size(), live, hits, misses, ttl);
    }

    public Duration ttl() {
        return ttl;
    }

    private boolean isExpired(Slot<V> e, Instant now) {
        return Duration.between(e.storedAt(), now).compareTo(ttl) >= 0;
    }

    private record Slot<V>(V value, Instant storedAt) {}

    public record Stats(int totalEntries, int liveEntries, long hits, long misses, Duration ttl) {
        public double hitRate() {
            long lookups = hits + misses;
            return lookups == 0 ? 0.0 : (double) hits / lookups;
        }
    }
}
