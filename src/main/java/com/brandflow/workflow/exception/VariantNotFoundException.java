package com.brandflow.workflow.exception;

/**
 * Raised when a selection names a variant or suggestion that is not part of the current set.
 */
public class VariantNotFoundException extends BrandFlowException {

    private static final long serialVersionUID = 1L;

    public VariantNotFoundException(String message) {
        super("VARIANT_NOT_FOUND", message);
    }
}
