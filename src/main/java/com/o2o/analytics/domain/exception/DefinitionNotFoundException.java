package com.o2o.analytics.domain.exception;

import lombok.Getter;

@Getter
public class DefinitionNotFoundException extends EngineException {

    private final String definitionId;

    public DefinitionNotFoundException(String definitionId) {
        super(ErrorCodes.DEFINITION_NOT_FOUND, "Aggregation definition not found: " + definitionId);
        this.definitionId = definitionId;
    }
}
