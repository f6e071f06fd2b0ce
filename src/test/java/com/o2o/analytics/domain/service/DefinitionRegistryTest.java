package com.o2o.analytics.domain.service;

import com.o2o.analytics.config.EngineProperties;
import com.o2o.analytics.domain.exception.DefinitionNotFoundException;
import com.o2o.analytics.domain.model.AggregationDefinition;
import com.o2o.analytics.domain.model.BucketGranularity;
import com.o2o.analytics.domain.model.DefinitionRegisteredEvent;
import com.o2o.analytics.domain.model.Reducer;
import com.o2o.analytics.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DefinitionRegistryTest {

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private EngineProperties properties;
    private DefinitionRegistry registry;

    @BeforeEach
    void setUp() {
        properties = new EngineProperties();
        properties.getDefinitions().add(configured("store_daily_summary"));
        registry = new DefinitionRegistry(properties, new AggregationEvaluator(), eventPublisher);
        registry.loadConfigured();
    }

    @Test
    void testLoadConfigured_NoEvents() {
        // Then
        AggregationDefinition loaded = registry.require("store_daily_summary");
        assertEquals(List.of("store_id"), loaded.getGroupBy());
        assertEquals("order_count", loaded.primaryMeasureName());
        assertEquals(Reducer.COUNT_DISTINCT, loaded.getMeasures().get(0).getReducer());
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void testRegister_NewDefinitionPublishesEvent() {
        // When
        registry.register(Fixtures.storeMonthly());

        // Then
        ArgumentCaptor<DefinitionRegisteredEvent> captor = ArgumentCaptor.forClass(DefinitionRegisteredEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertEquals(Fixtures.STORE_MONTHLY, captor.getValue().getDefinition().getId());
        assertFalse(captor.getValue().isReplaced());
        assertEquals(2, registry.all().size());
    }

    @Test
    void testRegister_SameDefinitionTwiceIsSilent() {
        // Given
        registry.register(Fixtures.storeMonthly());

        // When
        registry.register(Fixtures.storeMonthly());

        // Then
        verify(eventPublisher, times(1)).publishEvent(any(Object.class));
    }

    @Test
    void testRegister_InvalidDefinitionRejected() {
        AggregationDefinition invalid = AggregationDefinition.builder().id("empty").build();

        assertThrows(IllegalArgumentException.class, () -> registry.register(invalid));
        assertTrue(registry.find("empty").isEmpty());
    }

    @Test
    void testReload_DropsMissingDefinitions() {
        // When
        registry.reload(List.of(Fixtures.storeMonthly()));

        // Then
        assertTrue(registry.find("store_daily_summary").isEmpty());
        assertTrue(registry.find(Fixtures.STORE_MONTHLY).isPresent());
    }

    @Test
    void testRequire_UnknownDefinition() {
        DefinitionNotFoundException e = assertThrows(DefinitionNotFoundException.class,
                () -> registry.require("nope"));
        assertEquals(4040, e.getErrorCode());
    }

    private static EngineProperties.DefinitionProperties configured(String id) {
        EngineProperties.MeasureProperties orderCount = new EngineProperties.MeasureProperties();
        orderCount.setName("order_count");
        orderCount.setSource("order_id");
        orderCount.setReducer(Reducer.COUNT_DISTINCT);

        EngineProperties.MeasureProperties revenue = new EngineProperties.MeasureProperties();
        revenue.setName("total_revenue");
        revenue.setSource("(actual_price ?: 0) * (quantity ?: 1)");

        EngineProperties.DerivedProperties avg = new EngineProperties.DerivedProperties();
        avg.setName("avg_order_value");
        avg.setFormula("order_count > 0 ? total_revenue / order_count : 0");

        EngineProperties.DefinitionProperties definition = new EngineProperties.DefinitionProperties();
        definition.setId(id);
        definition.setGroupBy(List.of("store_id"));
        definition.setBucket(BucketGranularity.DAY);
        definition.setPrimaryMeasure("order_count");
        definition.setMeasures(List.of(orderCount, revenue));
        definition.setDerived(List.of(avg));
        return definition;
    }
}
