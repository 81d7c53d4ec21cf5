package com.counterfactual.engine.domain.exception;

import lombok.Getter;

/**
 * No usable column mapping could be resolved. Aborts the whole run.
 */
@Getter
public class SchemaException extends CounterfactualException {

    public enum Reason {
        EMPTY_TABLE,
        NO_TIME_COLUMN,
        NO_TARGET_COLUMN,
        MISSING_REQUIRED_COLUMN,
        NO_USABLE_ROWS
    }

    private final Reason reason;

    public SchemaException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
