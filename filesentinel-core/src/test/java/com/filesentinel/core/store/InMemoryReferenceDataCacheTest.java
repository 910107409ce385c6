package com.filesentinel.core.store;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class InMemoryReferenceDataCacheTest {

    private static class MutableClock extends Clock {
        private Instant now = Instant.parse("2024-06-01T00:00:00Z");

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

    private final MutableClock clock = new MutableClock();
    private final InMemoryReferenceDataCache cache = new InMemoryReferenceDataCache(clock);

    @Test
    void entryExpiresAfterTtl() {
        cache.put("k", "v", Duration.ofMinutes(5));

        clock.advance(Duration.ofMinutes(4));
        assertEquals("v", cache.get("k", String.class));

        clock.advance(Duration.ofMinutes(2));
        assertNull(cache.get("k", String.class));
    }

    @Test
    void wrongTypeReadsAsMiss() {
        cache.put("k", 42, Duration.ofMinutes(5));

        assertNull(cache.get("k", String.class));
        assertEquals(42, cache.get("k", Integer.class));
    }

    @Test
    void invalidateRemovesEntry() {
        cache.put("k", "v", null);
        cache.invalidate("k");

        assertNull(cache.get("k", String.class));
    }
}
