package com.pmatic.ccu.client.transport;

/**
 * The transport could not reach the remote endpoint, or the connection failed while a call was in flight.
 */
public class RemotingConnectException extends RemotingException {

    private static final long serialVersionUID = -5565366231695911316L;

    public RemotingConnectException(String message, Throwable cause) {
        super(message, cause);
    }

    public RemotingConnectException(String message) {
        super(message);
    }
}
