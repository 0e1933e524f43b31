package com.pmatic.ccu.client.api.exception;

/**
 * Thrown when the connection to the controller can not be opened, or breaks down during a call.
 * The caller decides whether to retry.
 */
public class ConnectionException extends ClientException {

    private static final long serialVersionUID = 4102385660127733180L;

    private final String address;

    public ConnectionException(String address, String message, Throwable cause) {
        super(message, cause);
        this.address = address;
    }

    /**
     * @return the normalized address of the controller the client talks to.
     */
    public String getAddress() {
        return address;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.CONNECTION;
    }
}
