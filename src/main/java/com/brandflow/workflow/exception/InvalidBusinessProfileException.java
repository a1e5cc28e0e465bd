package com.brandflow.workflow.exception;

public class InvalidBusinessProfileException extends ValidationException {

    private static final long serialVersionUID = 1L;

    public InvalidBusinessProfileException(String message) {
        super("INVALID_PROFILE", message);
    }
}
