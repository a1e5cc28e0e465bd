package com.brandflow.workflow.exception;

/**
 * Cardinality, step-order or input violations. Always fatal; inputs are never coerced.
 */
public class ValidationException extends BrandFlowException {

    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }

    protected ValidationException(String code, String message) {
        super(code, message);
    }
}
