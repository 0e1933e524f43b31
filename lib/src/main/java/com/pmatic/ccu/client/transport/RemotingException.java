package com.pmatic.ccu.client.transport;

/**
 * Base class of the failures reported by an {@link RpcTransport}.
 */
public class RemotingException extends Exception {

    private static final long serialVersionUID = 6338133491680948104L;

    public RemotingException(String message, Throwable cause) {
        super(message, cause);
    }

    public RemotingException(String message) {
        super(message);
    }
}
