package com.openforge.connectors.error;

/**
 * Request parameters were rejected, either locally (temperature out of range,
 * non-positive max tokens) or by the provider (HTTP 400/422).
 */
public class ProviderParameterException extends ProviderException {

    public ProviderParameterException(String provider, Integer status, String message) {
        super(ErrorKind.PROVIDER_PARAMETER, provider, status, message, null);
    }
}
