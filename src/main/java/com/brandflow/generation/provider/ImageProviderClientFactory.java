package com.brandflow.generation.provider;

/**
 * Builds provider clients for the configured provider mode.
 */
public interface ImageProviderClientFactory {

    /**
     * @throws ProviderException with {@link ProviderErrorType#MISSING_CREDENTIALS} when the
     *                           provider is not configured well enough to be called
     */
    ImageProviderClient create(String providerId);
}
