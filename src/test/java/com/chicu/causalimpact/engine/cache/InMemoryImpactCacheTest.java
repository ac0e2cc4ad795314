package com.chicu.causalimpact.engine.cache;

import com.chicu.causalimpact.engine.ImpactAnalysis;
import com.chicu.causalimpact.engine.ImpactConfig;
import com.chicu.causalimpact.series.Period;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryImpactCacheTest {

    private static final Period PRE = new Period(Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-02-01T00:00:00Z"));
    private static final Period POST = new Period(Instant.parse("2024-02-02T00:00:00Z"), Instant.parse("2024-03-01T00:00:00Z"));

    private static ImpactCacheKey key(String seriesId, String group) {
        return new ImpactCacheKey(seriesId, group, PRE, POST, ImpactConfig.defaults());
    }

    private static ImpactAnalysis analysis(String group) {
        return ImpactAnalysis.builder().seriesId("s").groupKey(group).build();
    }

    @Test
    void storesAndReturnsByKey() {
        InMemoryImpactCache cache = new InMemoryImpactCache(4);
        ImpactAnalysis a = analysis("M1");

        cache.put(key("s", "M1"), a);

        assertSame(a, cache.get(key("s", "M1")).orElseThrow());
        assertTrue(cache.get(key("s", "M2")).isEmpty());
        assertTrue(cache.get(new ImpactCacheKey("s", "M1", PRE, POST,
                ImpactConfig.defaults().toBuilder().seed(1L).build())).isEmpty());
    }

    @Test
    void evictsLeastRecentlyUsed() {
        InMemoryImpactCache cache = new InMemoryImpactCache(2);
        cache.put(key("s", "A"), analysis("A"));
        cache.put(key("s", "B"), analysis("B"));

        // A становится самым свежим
        assertTrue(cache.get(key("s", "A")).isPresent());
        cache.put(key("s", "C"), analysis("C"));

        assertEquals(2, cache.size());
        assertTrue(cache.get(key("s", "A")).isPresent());
        assertTrue(cache.get(key("s", "B")).isEmpty());
        assertTrue(cache.get(key("s", "C")).isPresent());
    }

    @Test
    void invalidateRemovesOnlyThatSeries() {
        InMemoryImpactCache cache = new InMemoryImpactCache(8);
        cache.put(key("s1", "A"), analysis("A"));
        cache.put(key("s1", "B"), analysis("B"));
        cache.put(key("s2", "A"), analysis("A"));

        assertEquals(2, cache.invalidate("s1"));
        assertEquals(1, cache.size());
        assertTrue(cache.get(key("s2", "A")).isPresent());
        assertEquals(0, cache.invalidate("missing"));
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryImpactCache(0));
    }
}
