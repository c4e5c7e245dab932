package com.wordduel;

import com.wordduel.cache.TtlCache;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TtlCacheTest {
    @Test
    void entriesExpireAfterTheirTimeToLive() {
        MutableClock clock = new MutableClock();
        TtlCache<String, Integer> cache = new TtlCache<>(clock, Duration.ofMinutes(10));
        cache.put("long", 1);
        cache.put("short", 2, Duration.ofSeconds(60));

        clock.advance(Duration.ofSeconds(59));
        assertEquals(Optional.of(2), cache.get("short"));

        clock.advance(Duration.ofSeconds(1));
        assertTrue(cache.get("short").isEmpty());
        assertEquals(Optional.of(1), cache.get("long"));

        clock.advance(Duration.ofMinutes(10));
        cache.purgeExpired();
        assertEquals(0, cache.size());
    }

    @Test
    void invalidateRemovesEntry() {
        TtlCache<Long, String> cache = new TtlCache<>(new MutableClock(), Duration.ofMinutes(1));
        cache.put(1L, "one");
        cache.invalidate(1L);
        assertTrue(cache.get(1L).isEmpty());
    }
}
