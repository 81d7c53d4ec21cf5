package com.counterfactual.engine.domain.exception;

import lombok.Getter;

/**
 * Not enough history for one entity, or for one (entity, event) pair. Skips only that scope.
 */
@Getter
public class InsufficientDataException extends CounterfactualException {

    private final String entityId;
    private final int available;
    private final int required;

    public InsufficientDataException(String entityId, int available, int required, String message) {
        super(message);
        this.entityId = entityId;
        this.available = available;
        this.required = required;
    }
}
