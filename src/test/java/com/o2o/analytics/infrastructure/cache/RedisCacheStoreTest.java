package com.o2o.analytics.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.o2o.analytics.domain.model.EngineResult;
import com.o2o.analytics.domain.model.EngineType;
import com.o2o.analytics.domain.model.ResultRow;
import com.o2o.analytics.domain.model.ResultSet;
import com.o2o.analytics.domain.model.TimeWindow;
import com.o2o.analytics.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RedisCacheStore against a mocked RedisTemplate.
 */
@ExtendWith(MockitoExtension.class)
class RedisCacheStoreTest {

    @Mock
    private RedisTemplate<String, String> redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private ObjectMapper objectMapper;
    private MutableClock clock;
    private RedisCacheStore store;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        clock = MutableClock.at("2026-01-10T08:00:00Z");
        store = new RedisCacheStore(redisTemplate, objectMapper, clock, "o2o:query");
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    }

    @Test
    void testPut_WritesEnvelopeWithTtl() throws Exception {
        // Given
        CacheEntry<EngineResult> entry = new CacheEntry<>(result(), false, 42L,
                clock.instant().plus(Duration.ofMinutes(30)));

        // When
        store.put("o2o:query:store_daily_summary:*:2026-01-01..2026-01-01", entry);

        // Then
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).set(eq("o2o:query:store_daily_summary:*:2026-01-01..2026-01-01"),
                json.capture(), eq(Duration.ofMinutes(30).toMillis()), eq(TimeUnit.MILLISECONDS));
        assertEquals(42L, objectMapper.readTree(json.getValue()).path("dataVersion").asLong());
    }

    @Test
    void testGet_ReadsEnvelopeBack() throws Exception {
        // Given
        CacheEntry<EngineResult> entry = new CacheEntry<>(result(), false, 42L,
                clock.instant().plus(Duration.ofMinutes(30)));
        when(valueOperations.get("k")).thenReturn(objectMapper.writeValueAsString(entry));

        // When
        Optional<CacheEntry<EngineResult>> read = store.get("k", EngineResult.class);

        // Then
        assertTrue(read.isPresent());
        assertEquals(42L, read.get().getDataVersion());
        assertEquals(EngineType.AGGREGATE_STORE, read.get().getValue().getEngine());
        assertEquals(3.0, read.get().getValue().getResultSet().getRows().get(0).getMeasures().get("order_count"));
        assertEquals(LocalDate.parse("2026-01-01"), read.get().getValue().getResultSet().getWindow().getStart());
    }

    @Test
    void testPut_KeepsNewerStoredVersion() throws Exception {
        // Given
        CacheEntry<String> newer = new CacheEntry<>("new", false, 9L, clock.instant().plus(Duration.ofMinutes(5)));
        when(valueOperations.get("k")).thenReturn(objectMapper.writeValueAsString(newer));

        // When
        store.put("k", new CacheEntry<>("old", false, 8L, clock.instant().plus(Duration.ofMinutes(5))));

        // Then
        verify(valueOperations, never()).set(anyString(), anyString(), anyLong(), any(TimeUnit.class));
    }

    @Test
    void testGet_UnreadableEntryDropped() {
        // Given
        when(valueOperations.get("k")).thenReturn("{not json");

        // When
        Optional<CacheEntry<String>> read = store.get("k", String.class);

        // Then
        assertTrue(read.isEmpty());
        verify(redisTemplate).delete("k");
    }

    @Test
    void testGet_Miss() {
        when(valueOperations.get("k")).thenReturn(null);

        assertTrue(store.get("k", String.class).isEmpty());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testEvictByPrefix_ScansKeyspace() {
        // Given
        Cursor<String> cursor = mock(Cursor.class);
        when(cursor.hasNext()).thenReturn(true, true, false);
        when(cursor.next()).thenReturn("o2o:query:store_daily_summary:a", "o2o:query:store_daily_summary:b");
        when(redisTemplate.scan(any(ScanOptions.class))).thenReturn(cursor);
        when(redisTemplate.delete(anyCollection())).thenReturn(2L);

        // When
        long deleted = store.evictByPrefix("o2o:query:store_daily_summary:");

        // Then
        assertEquals(2L, deleted);
        ArgumentCaptor<ScanOptions> options = ArgumentCaptor.forClass(ScanOptions.class);
        verify(redisTemplate).scan(options.capture());
        assertEquals("o2o:query:store_daily_summary:*", options.getValue().getPattern());
        verify(redisTemplate).delete(List.of("o2o:query:store_daily_summary:a", "o2o:query:store_daily_summary:b"));
        verify(redisTemplate, never()).keys(anyString());
        verify(cursor).close();
    }

    @Test
    @SuppressWarnings("unchecked")
    void testSize_CountsScannedKeys() {
        // Given
        Cursor<String> cursor = mock(Cursor.class);
        when(cursor.hasNext()).thenReturn(true, true, true, false);
        when(cursor.next()).thenReturn("o2o:query:a", "o2o:query:b", "o2o:query:c");
        when(redisTemplate.scan(any(ScanOptions.class))).thenReturn(cursor);

        // When / Then
        assertEquals(3L, store.size());
        verify(redisTemplate, never()).delete(anyCollection());
    }

    private static EngineResult result() {
        ResultRow row = ResultRow.builder()
                .dimensions(Map.of("store_id", "S1"))
                .bucket(LocalDate.parse("2026-01-01"))
                .measures(Map.of("order_count", 3.0))
                .sourceRowCount(3)
                .build();
        return EngineResult.builder()
                .resultSet(ResultSet.builder()
                        .definitionId("store_daily_summary")
                        .window(TimeWindow.day(LocalDate.parse("2026-01-01")))
                        .rows(List.of(row))
                        .build())
                .engine(EngineType.AGGREGATE_STORE)
                .dataVersion(42L)
                .build();
    }
}
