package space.ketterling.sensornet.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InMemoryResponseCache")
class InMemoryResponseCacheTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2016-10-08T00:00:00Z"));

    @Test
    @DisplayName("the same body always gets the same quoted ETag")
    void etagIsStable() {
        InMemoryResponseCache cache = new InMemoryResponseCache(clock, 60, 100);

        ResponseCache.CachedResponse first = cache.put("/a", "{\"data\":[]}");
        ResponseCache.CachedResponse second = cache.put("/b", "{\"data\":[]}");

        assertThat(first.etag()).isEqualTo(second.etag()).startsWith("\"").endsWith("\"").hasSize(66);
        assertThat(cache.get("/a")).isEqualTo(first);
        assertThat(first.maxAgeSeconds()).isEqualTo(60);
    }

    @Test
    @DisplayName("different bodies get different ETags")
    void etagFollowsBody() {
        assertThat(ResponseCache.CachedResponse.etag("{\"total\":1}"))
                .isNotEqualTo(ResponseCache.CachedResponse.etag("{\"total\":2}"));
    }

    @Test
    @DisplayName("entries expire after their TTL")
    void expires() {
        InMemoryResponseCache cache = new InMemoryResponseCache(clock, 10, 100);
        cache.put("/a", "{}");

        clock.advance(Duration.ofSeconds(9));
        assertThat(cache.get("/a")).isNotNull();

        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.get("/a")).isNull();
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("expired entries are dropped even when their keys are never read again")
    void expiredEntriesAreDroppedWithoutReads() {
        InMemoryResponseCache cache = new InMemoryResponseCache(clock, 600, 50_000);
        for (int i = 0; i < 10_000; i++)
            cache.put("/v1/api/sensor-networks?junk=" + i, "{}");
        assertThat(cache.size()).isEqualTo(10_000);

        clock.advance(Duration.ofDays(1));
        cache.put("/v1/api/sensor-networks", "{}");

        assertThat(cache.size()).isLessThanOrEqualTo(1);
    }

    @Test
    @DisplayName("the number of entries never exceeds the configured maximum")
    void boundedInSize() {
        InMemoryResponseCache cache = new InMemoryResponseCache(clock, 600, 100);
        for (int i = 0; i < 1_000; i++)
            cache.put("/v1/api/sensor-networks?junk=" + i, "{}");

        assertThat(cache.size()).isLessThanOrEqualTo(100);
    }

    @Test
    void rejectsNonPositiveTtl() {
        assertThatThrownBy(() -> new InMemoryResponseCache(clock, 0, 100))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }

        @Override
        public long millis() {
            return now.toEpochMilli();
        }
    }
}
