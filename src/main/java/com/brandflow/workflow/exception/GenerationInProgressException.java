package com.brandflow.workflow.exception;

public class GenerationInProgressException extends BrandFlowException {

    private static final long serialVersionUID = 1L;

    public GenerationInProgressException(String message) {
        super("GENERATION_IN_PROGRESS", message);
    }
}
