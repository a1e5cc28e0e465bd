package com.brandflow.workflow.exception;

import lombok.Getter;

/**
 * Base type for workflow failures that carry a stable error code.
 * <p>
 * Codes are part of the HTTP error contract, so they never change once published.
 */
@Getter
public class BrandFlowException extends RuntimeException {

    private static final long serialVersionUID = 4213874907234120651L;

    private final String code;

    public BrandFlowException(String code, String message) {
        super(message);
        this.code = code;
    }

    public BrandFlowException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{code='" + code + "', message='" + getMessage() + "'}";
    }
}
