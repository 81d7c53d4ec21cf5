package com.counterfactual.engine.domain.exception;

public abstract class CounterfactualException extends RuntimeException {

    protected CounterfactualException(String message) {
        super(message);
    }
}
