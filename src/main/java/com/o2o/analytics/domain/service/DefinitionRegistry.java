package com.o2o.analytics.domain.service;

import com.o2o.analytics.config.EngineProperties;
import com.o2o.analytics.domain.exception.DefinitionNotFoundException;
import com.o2o.analytics.domain.model.AggregationDefinition;
import com.o2o.analytics.domain.model.DefinitionRegisteredEvent;
import com.o2o.analytics.domain.model.DerivedFieldSpec;
import com.o2o.analytics.domain.model.MeasureSpec;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Registered aggregation definitions.
 *
 * Definitions from {@code o2o.engine.definitions} load at startup without
 * triggering a backfill (the startup consistency pass covers them). Definitions
 * registered later publish a {@link DefinitionRegisteredEvent}, which schedules
 * their backfill.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefinitionRegistry {

    private final EngineProperties properties;
    private final AggregationEvaluator evaluator;
    private final ApplicationEventPublisher eventPublisher;

    private final Map<String, AggregationDefinition> definitions = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadConfigured() {
        for (EngineProperties.DefinitionProperties props : properties.getDefinitions()) {
            AggregationDefinition definition = toDefinition(props);
            evaluator.validate(definition);
            definitions.put(definition.getId(), definition);
        }
        log.info("Loaded {} aggregation definitions: {}", definitions.size(), definitions.keySet());
    }

    /**
     * Adds or replaces a definition.
     *
     * @throws IllegalArgumentException when the definition is invalid
     */
    public AggregationDefinition register(AggregationDefinition definition) {
        evaluator.validate(definition);
        AggregationDefinition previous = definitions.put(definition.getId(), definition);
        if (definition.equals(previous)) {
            return definition;
        }
        boolean replaced = previous != null;
        log.info("{} aggregation definition {}", replaced ? "Replaced" : "Registered", definition.getId());
        eventPublisher.publishEvent(new DefinitionRegisteredEvent(definition, replaced));
        return definition;
    }

    /**
     * Replaces the whole set. Definitions absent from {@code replacement} are dropped.
     */
    public void reload(List<AggregationDefinition> replacement) {
        replacement.forEach(evaluator::validate);
        Set<String> keep = replacement.stream().map(AggregationDefinition::getId).collect(Collectors.toSet());
        for (String id : new HashSet<>(definitions.keySet())) {
            if (!keep.contains(id)) {
                definitions.remove(id);
                log.info("Dropped aggregation definition {}", id);
            }
        }
        replacement.forEach(this::register);
    }

    public AggregationDefinition require(String definitionId) {
        return find(definitionId).orElseThrow(() -> new DefinitionNotFoundException(definitionId));
    }

    public Optional<AggregationDefinition> find(String definitionId) {
        if (definitionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(definitions.get(definitionId));
    }

    public List<AggregationDefinition> all() {
        List<AggregationDefinition> all = new ArrayList<>(definitions.values());
        all.sort(Comparator.comparing(AggregationDefinition::getId));
        return all;
    }

    static AggregationDefinition toDefinition(EngineProperties.DefinitionProperties props) {
        AggregationDefinition.AggregationDefinitionBuilder builder = AggregationDefinition.builder()
                .id(props.getId())
                .description(props.getDescription())
                .groupBy(props.getGroupBy())
                .bucket(props.getBucket())
                .filterExpression(props.getFilter())
                .primaryMeasure(props.getPrimaryMeasure());
        for (EngineProperties.MeasureProperties m : props.getMeasures()) {
            builder.measure(MeasureSpec.builder()
                    .name(m.getName())
                    .source(m.getSource())
                    .reducer(m.getReducer())
                    .orderLevel(m.isOrderLevel())
                    .build());
        }
        for (EngineProperties.DerivedProperties d : props.getDerived()) {
            builder.derivedField(new DerivedFieldSpec(d.getName(), d.getFormula()));
        }
        return builder.build();
    }
}
