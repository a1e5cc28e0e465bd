package com.brandflow.workflow.exception;

/**
 * Another writer replaced the session record since it was read.
 */
public class SessionVersionConflictException extends BrandFlowException {

    private static final long serialVersionUID = 1L;

    public SessionVersionConflictException(String message) {
        super("VERSION_CONFLICT", message);
    }
}
