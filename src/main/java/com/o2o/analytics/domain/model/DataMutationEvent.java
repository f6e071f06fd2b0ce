package com.o2o.analytics.domain.model;

import lombok.Value;

import java.util.Set;

/**
 * Raw facts changed inside {@code window}. An empty definition set means every definition.
 */
@Value
public class DataMutationEvent {

    MutationType type;
    Set<String> definitionIds;
    TimeWindow window;
    int affectedRows;

    public enum MutationType {
        IMPORT,
        DELETE
    }

    public static DataMutationEvent allDefinitions(MutationType type, TimeWindow window, int affectedRows) {
        return new DataMutationEvent(type, Set.of(), window, affectedRows);
    }

    public boolean affects(String definitionId) {
        return definitionIds.isEmpty() || definitionIds.contains(definitionId);
    }
}
