package com.openforge.connectors.error;

/**
 * Provider refused the API key (HTTP 401/403).
 */
public class ProviderAuthenticationException extends ProviderException {

    public ProviderAuthenticationException(String provider, Integer status, String message) {
        super(ErrorKind.PROVIDER_AUTHENTICATION, provider, status, message, null);
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
