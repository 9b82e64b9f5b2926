package com.openforge.connectors.error;

/**
 * A chat provider rejected or failed a request in a way the transport did
 * not classify as transient.
 */
public class ProviderException extends ConnectorException {

    private final String provider;
    private final Integer status;

    public ProviderException(String provider, Integer status, String message) {
        this(ErrorKind.PROVIDER, provider, status, message, null);
    }

    public ProviderException(String provider, String message, Throwable cause) {
        this(ErrorKind.PROVIDER, provider, null, message, cause);
    }

    protected ProviderException(ErrorKind kind, String provider, Integer status,
                                String message, Throwable cause) {
        super(kind, "[%s] %s".formatted(provider, message), cause);
        this.provider = provider;
        this.status = status;
    }

    public String provider() {
        return provider;
    }

    public Integer status() {
        return status;
    }
}
