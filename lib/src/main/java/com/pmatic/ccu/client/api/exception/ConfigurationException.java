package com.pmatic.ccu.client.api.exception;

public class ConfigurationException extends ClientException {

    private static final long serialVersionUID = -2937011248417352561L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.CONFIGURATION;
    }
}
