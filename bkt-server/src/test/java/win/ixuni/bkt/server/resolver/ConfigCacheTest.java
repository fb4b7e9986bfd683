package win.ixuni.bkt.server.resolver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigCacheTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));

    private final ConfigCache cache = new ConfigCache(Duration.ofMinutes(5), clock);

    @Test
    @DisplayName("Entries expire after the TTL")
    void testTtl() {
        cache.put("cfg-1", config("cfg-1"));
        assertEquals("cfg-1", cache.get("cfg-1").orElseThrow().getSource());

        clock.advance(Duration.ofMinutes(4).plusSeconds(59));
        assertTrue(cache.get("cfg-1").isPresent());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(cache.get("cfg-1").isEmpty());
    }

    @Test
    @DisplayName("invalidateAll empties the cache")
    void testInvalidateAll() {
        cache.put("cfg-1", config("cfg-1"));
        cache.put(ConfigCache.DEFAULT_KEY, config("cfg-2"));
        assertEquals(2, cache.size());

        cache.invalidateAll();

        assertEquals(0, cache.size());
        assertTrue(cache.get("cfg-1").isEmpty());
        assertTrue(cache.get(ConfigCache.DEFAULT_KEY).isEmpty());
    }

    @Test
    @DisplayName("Writing purges expired entries")
    void testPutPurgesExpired() {
        cache.put("old", config("old"));
        clock.advance(Duration.ofMinutes(10));
        cache.put("new", config("new"));

        assertEquals(1, cache.size());
        assertTrue(cache.get("new").isPresent());
    }

    private static ResolvedS3Config config(String source) {
        return ResolvedS3Config.builder()
                .source(source)
                .endpoint("localhost:9000")
                .region("us-east-1")
                .accessKey("ak")
                .secretKey("sk")
                .bucketPrefix("")
                .useSsl(false)
                .forcePathStyle(true)
                .build();
    }

    static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
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
    }
}
