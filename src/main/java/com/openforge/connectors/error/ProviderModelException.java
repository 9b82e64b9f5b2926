package com.openforge.connectors.error;

/**
 * The configured model does not exist or is not available to this key.
 */
public class ProviderModelException extends ProviderException {

    public ProviderModelException(String provider, Integer status, String message) {
        super(ErrorKind.PROVIDER_MODEL, provider, status, message, null);
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
