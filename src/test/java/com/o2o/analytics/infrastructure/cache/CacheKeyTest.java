package com.o2o.analytics.infrastructure.cache;

import com.o2o.analytics.domain.model.TimeWindow;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CacheKey.
 */
class CacheKeyTest {

    private static final TimeWindow WINDOW =
            TimeWindow.of(LocalDate.parse("2026-01-01"), LocalDate.parse("2026-01-03"));

    @Test
    void testOf_SeparatorsInValuesDoNotCollide() {
        // Given: one filter whose value carries the separators vs two filters
        CacheKey single = CacheKey.of("store_daily_summary", Map.of("channel", "app,store_id=S1"), WINDOW);
        CacheKey pair = CacheKey.of("store_daily_summary", Map.of("store_id", "S1", "channel", "app"), WINDOW);

        // Then
        assertNotEquals(single, pair);
        assertNotEquals(single.render("o2o"), pair.render("o2o"));
    }

    @Test
    void testOf_EqualsSignInKeyDoesNotCollide() {
        // Given
        CacheKey splitInKey = CacheKey.of("store_daily_summary", Map.of("a=b", "c"), WINDOW);
        CacheKey splitInValue = CacheKey.of("store_daily_summary", Map.of("a", "b=c"), WINDOW);

        // Then
        assertNotEquals(splitInKey.getFingerprint(), splitInValue.getFingerprint());
    }

    @Test
    void testOf_FilterOrderIrrelevant() {
        // Given
        Map<String, String> forward = new LinkedHashMap<>();
        forward.put("store_id", "S1");
        forward.put("channel", "app");
        Map<String, String> reverse = new LinkedHashMap<>();
        reverse.put("channel", "app");
        reverse.put("store_id", "S1");

        // Then
        assertEquals(CacheKey.of("store_daily_summary", forward, WINDOW),
                CacheKey.of("store_daily_summary", reverse, WINDOW));
    }

    @Test
    void testRender_SharesDefinitionPrefix() {
        // Given
        CacheKey key = CacheKey.of("store_daily_summary", Map.of(), WINDOW);

        // Then
        assertTrue(key.render("o2o").startsWith(CacheKey.definitionPrefix("o2o", "store_daily_summary")));
        assertTrue(key.getFingerprint().startsWith("*:"));
    }
}
