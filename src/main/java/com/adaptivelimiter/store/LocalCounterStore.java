package com.adaptivelimiter.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process counter store for single-node deployments and tests.
 * <p>
 * Entries live in a Caffeine cache whose per-entry expiry follows the injected {@link Clock}.
 * Every operation runs while holding the lock stripes of the keys it touches, taken in stripe
 * order, so a script is indivisible with respect to any other call on the same keys. Lock waits
 * are bounded; a timeout surfaces as {@link StoreUnavailableException} like a Redis timeout would.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "ratelimiter.store.type", havingValue = "local")
public class LocalCounterStore implements CounterStore {

    private static final int STRIPES = 64;

    private final Clock clock;
    private final long lockTimeoutNanos;
    private final Cache<String, StoreEntry> entries;
    private final ReentrantLock[] locks = new ReentrantLock[STRIPES];

    public LocalCounterStore(Clock clock,
                             @Value("${ratelimiter.store.local.lock-timeout-ms:250}") long lockTimeoutMillis,
                             @Value("${ratelimiter.store.local.max-keys:100000}") long maxKeys) {
        this.clock = clock;
        this.lockTimeoutNanos = TimeUnit.MILLISECONDS.toNanos(lockTimeoutMillis);
        long origin = clock.millis();
        this.entries = Caffeine.newBuilder()
                .maximumSize(maxKeys)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis() - origin))
                .expireAfter(new EntryExpiry())
                .build();
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
        log.info("Initialized local counter store: maxKeys={}, lockTimeout={}ms", maxKeys, lockTimeoutMillis);
    }

    @Override
    public List<Long> execute(CounterScript script, List<String> keys, List<String> args) {
        List<ReentrantLock> held = lockAll(keys);
        try {
            return switch (script) {
                case TOKEN_BUCKET -> tokenBucket(keys.get(0), args);
                case SLIDING_WINDOW -> slidingWindow(keys.get(0), keys.get(1), args);
                case FIXED_WINDOW -> fixedWindow(keys.get(0), args);
            };
        } catch (NumberFormatException | IndexOutOfBoundsException e) {
            throw new StoreUnavailableException("Invalid arguments for script " + script, e);
        } finally {
            unlockAll(held);
        }
    }

    @Override
    public Map<String, String> getHash(String key) {
        List<ReentrantLock> held = lockAll(List.of(key));
        try {
            StoreEntry entry = live(key, clock.millis());
            return entry != null && entry.hash != null ? Map.copyOf(entry.hash) : Map.of();
        } finally {
            unlockAll(held);
        }
    }

    @Override
    public void putHash(String key, Map<String, String> fields, Duration ttl) {
        if (fields.isEmpty()) {
            return;
        }
        List<ReentrantLock> held = lockAll(List.of(key));
        try {
            long now = clock.millis();
            StoreEntry entry = live(key, now);
            Map<String, String> hash = entry != null && entry.hash != null
                    ? new HashMap<>(entry.hash) : new HashMap<>();
            hash.putAll(fields);
            entries.put(key, StoreEntry.ofHash(hash, now + ttl.toMillis()));
        } finally {
            unlockAll(held);
        }
    }

    @Override
    public Optional<String> get(String key) {
        List<ReentrantLock> held = lockAll(List.of(key));
        try {
            StoreEntry entry = live(key, clock.millis());
            return entry != null ? Optional.ofNullable(entry.value) : Optional.empty();
        } finally {
            unlockAll(held);
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        List<ReentrantLock> held = lockAll(List.of(key));
        try {
            entries.put(key, StoreEntry.ofValue(value, clock.millis() + ttl.toMillis()));
        } finally {
            unlockAll(held);
        }
    }

    @Override
    public void delete(String key) {
        List<ReentrantLock> held = lockAll(List.of(key));
        try {
            entries.invalidate(key);
        } finally {
            unlockAll(held);
        }
    }

    @Override
    public long deleteByPrefix(String prefix) {
        long removed = 0;
        Iterator<String> it = entries.asMap().keySet().iterator();
        while (it.hasNext()) {
            if (it.next().startsWith(prefix)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    @Override
    public Duration ping() {
        return Duration.ZERO;
    }

    public long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }

    // ─── Script bodies, mirroring src/main/resources/lua ─────────────

    private List<Long> tokenBucket(String bucketKey, List<String> args) {
        double capacity = Double.parseDouble(args.get(0));
        double refillRate = Double.parseDouble(args.get(1));
        long refillInterval = Long.parseLong(args.get(2));
        double requestTokens = Double.parseDouble(args.get(3));
        long now = Long.parseLong(args.get(4));
        double initialTokens = Double.parseDouble(args.get(5));

        StoreEntry entry = live(bucketKey, now);
        String storedTokens = entry != null && entry.hash != null ? entry.hash.get("tokens") : null;
        String storedRefill = entry != null && entry.hash != null ? entry.hash.get("lastRefill") : null;

        double tokens;
        long lastRefill;
        if (storedTokens == null || storedRefill == null) {
            tokens = Math.min(capacity, initialTokens);
            lastRefill = now;
        } else {
            tokens = Double.parseDouble(storedTokens);
            lastRefill = Long.parseLong(storedRefill);
        }

        double elapsedSeconds = (now - lastRefill) / 1000.0;
        double tokensToAdd = Math.max(0, Math.floor(elapsedSeconds / refillInterval) * refillRate);
        tokens = Math.min(capacity, tokens + tokensToAdd);
        if (tokensToAdd > 0) {
            lastRefill = now;
        }

        long allowed = 0;
        long retryAfter = 0;
        if (tokens >= requestTokens) {
            allowed = 1;
            tokens -= requestTokens;
        } else {
            double tokensNeeded = requestTokens - tokens;
            retryAfter = (long) Math.ceil(tokensNeeded / refillRate) * refillInterval;
        }

        Map<String, String> hash = new HashMap<>();
        hash.put("tokens", Double.toString(tokens));
        hash.put("lastRefill", Long.toString(lastRefill));
        entries.put(bucketKey, StoreEntry.ofHash(hash, now + TimeUnit.SECONDS.toMillis(refillInterval * 10)));

        return List.of(allowed, (long) Math.floor(tokens), retryAfter);
    }

    private List<Long> slidingWindow(String currentKey, String previousKey, List<String> args) {
        long limit = Long.parseLong(args.get(0));
        long subBucketMillis = Long.parseLong(args.get(1));
        long now = Long.parseLong(args.get(2));
        long currentStart = Long.parseLong(args.get(3));

        StoreEntry current = live(currentKey, now);
        long currentCount = current != null ? current.count() : 0;
        StoreEntry previous = live(previousKey, now);
        long previousCount = previous != null ? previous.count() : 0;

        double overlap = (double) (now - currentStart) / subBucketMillis;
        double weightedCount = previousCount * (1 - overlap) + currentCount;

        long allowed = 0;
        if (weightedCount < limit) {
            allowed = 1;
            currentCount++;
            entries.put(currentKey, StoreEntry.ofValue(Long.toString(currentCount), now + subBucketMillis * 2));
        }

        return List.of(allowed, (long) Math.ceil(weightedCount), currentCount);
    }

    private List<Long> fixedWindow(String counterKey, List<String> args) {
        long limit = Long.parseLong(args.get(0));
        long windowMillis = Long.parseLong(args.get(1));
        long now = clock.millis();

        StoreEntry entry = live(counterKey, now);
        long current = entry != null ? entry.count() : 0;

        long allowed = 0;
        if (current < limit) {
            allowed = 1;
            current++;
            entries.put(counterKey, StoreEntry.ofValue(Long.toString(current), now + windowMillis));
        }

        return List.of(allowed, current);
    }

    // ─── Locking ──────────────────────────────────────────────────────

    private List<ReentrantLock> lockAll(List<String> keys) {
        int[] stripes = keys.stream()
                .mapToInt(key -> (key.hashCode() & 0x7fffffff) % STRIPES)
                .distinct()
                .sorted()
                .toArray();
        List<ReentrantLock> held = new ArrayList<>(stripes.length);
        long deadline = System.nanoTime() + lockTimeoutNanos;
        try {
            for (int stripe : stripes) {
                long wait = Math.max(0, deadline - System.nanoTime());
                if (!locks[stripe].tryLock(wait, TimeUnit.NANOSECONDS)) {
                    throw new StoreUnavailableException("Timed out waiting for lock on " + keys);
                }
                held.add(locks[stripe]);
            }
            return held;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            unlockAll(held);
            throw new StoreUnavailableException("Interrupted while waiting for lock on " + keys, e);
        } catch (RuntimeException e) {
            unlockAll(held);
            throw e;
        }
    }

    private static void unlockAll(List<ReentrantLock> held) {
        for (int i = held.size() - 1; i >= 0; i--) {
            held.get(i).unlock();
        }
    }

    private StoreEntry live(String key, long now) {
        StoreEntry entry = entries.getIfPresent(key);
        if (entry != null && entry.expiresAtMillis <= now) {
            entries.invalidate(key);
            return null;
        }
        return entry;
    }

    private static final class StoreEntry {
        private final Map<String, String> hash;
        private final String value;
        private final long expiresAtMillis;

        private StoreEntry(Map<String, String> hash, String value, long expiresAtMillis) {
            this.hash = hash;
            this.value = value;
            this.expiresAtMillis = expiresAtMillis;
        }

        static StoreEntry ofHash(Map<String, String> hash, long expiresAtMillis) {
            return new StoreEntry(hash, null, expiresAtMillis);
        }

        static StoreEntry ofValue(String value, long expiresAtMillis) {
            return new StoreEntry(null, value, expiresAtMillis);
        }

        long count() {
            return value != null ? Long.parseLong(value) : 0;
        }
    }

    private final class EntryExpiry implements Expiry<String, StoreEntry> {

        @Override
        public long expireAfterCreate(String key, StoreEntry entry, long currentTime) {
            return remainingNanos(entry);
        }

        @Override
        public long expireAfterUpdate(String key, StoreEntry entry, long currentTime, long currentDuration) {
            return remainingNanos(entry);
        }

        @Override
        public long expireAfterRead(String key, StoreEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remainingNanos(StoreEntry entry) {
            return TimeUnit.MILLISECONDS.toNanos(Math.max(0, entry.expiresAtMillis - clock.millis()));
        }
    }
}
