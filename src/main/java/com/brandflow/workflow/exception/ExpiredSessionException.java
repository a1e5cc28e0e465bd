package com.brandflow.workflow.exception;

/**
 * The session passed its expiry instant. Only the transition into Expired is still written.
 */
public class ExpiredSessionException extends BrandFlowException {

    private static final long serialVersionUID = 1L;

    public ExpiredSessionException(String message) {
        super("SESSION_EXPIRED", message);
    }
}
