package com.brandflow.workflow.exception;

public class SessionNotFoundException extends BrandFlowException {

    private static final long serialVersionUID = 1L;

    public SessionNotFoundException(String message) {
        super("SESSION_NOT_FOUND", message);
    }
}
