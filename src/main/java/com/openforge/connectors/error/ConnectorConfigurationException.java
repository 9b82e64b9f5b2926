package com.openforge.connectors.error;

public class ConnectorConfigurationException extends ConnectorException {

    public ConnectorConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION, message);
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
