package space.ketterling.sensornet.api;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Process-local response cache, bounded in size, whose entries expire a fixed
 * time after they are written.
 */
public class InMemoryResponseCache implements ResponseCache {
    private final Cache<String, CachedResponse> entries;
    private final int ttlSeconds;

    public InMemoryResponseCache(Clock clock, int ttlSeconds, long maxEntries) {
        if (ttlSeconds < 1)
            throw new IllegalArgumentException("ttlSeconds must be at least 1, use NoopResponseCache to disable");
        this.ttlSeconds = ttlSeconds;
        this.entries = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterWrite(ttlSeconds, TimeUnit.SECONDS)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    @Override
    public CachedResponse get(String key) {
        return entries.getIfPresent(key);
    }

    @Override
    public CachedResponse put(String key, String body) {
        CachedResponse response = CachedResponse.of(body, ttlSeconds);
        entries.put(key, response);
        return response;
    }

    long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }
}
