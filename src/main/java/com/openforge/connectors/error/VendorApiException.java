package com.openforge.connectors.error;

/**
 * The vendor answered, but with an application-level error: either a
 * non-retryable HTTP status or an error payload inside a 2xx response.
 */
public class VendorApiException extends ConnectorException {

    private final String connector;
    private final int status;
    private final String vendorCode;

    public VendorApiException(String connector, int status, String vendorCode, String message) {
        super(ErrorKind.VENDOR_API,
                "[%s] HTTP %d%s: %s".formatted(connector, status,
                        vendorCode == null ? "" : " (" + vendorCode + ")", message));
        this.connector = connector;
        this.status = status;
        this.vendorCode = vendorCode;
    }

    public String connector() {
        return connector;
    }

    public int status() {
        return status;
    }

    public String vendorCode() {
        return vendorCode;
    }
}
