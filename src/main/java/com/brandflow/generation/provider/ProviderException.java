package com.brandflow.generation.provider;

import com.brandflow.workflow.exception.BrandFlowException;
import lombok.Getter;

import java.util.Locale;

/**
 * A classified failure of one provider call. Transient types are retried inside the
 * client; terminal types surface immediately.
 */
@Getter
public class ProviderException extends BrandFlowException {

    private static final long serialVersionUID = 1L;

    private final String providerId;
    private final ProviderErrorType type;

    public ProviderException(String providerId, ProviderErrorType type, String message) {
        super(codeFor(type), message);
        this.providerId = providerId;
        this.type = type;
    }

    public ProviderException(String providerId, ProviderErrorType type, String message, Throwable cause) {
        super(codeFor(type), message, cause);
        this.providerId = providerId;
        this.type = type;
    }

    public static ProviderException missingCredentials(String providerId, String detail) {
        return new ProviderException(providerId, ProviderErrorType.MISSING_CREDENTIALS,
                "Provider " + providerId + " cannot be constructed: " + detail);
    }

    public boolean isRetryable() {
        return type.isRetryable();
    }

    private static String codeFor(ProviderErrorType type) {
        return "PROVIDER_" + type.name().toUpperCase(Locale.ROOT);
    }
}
