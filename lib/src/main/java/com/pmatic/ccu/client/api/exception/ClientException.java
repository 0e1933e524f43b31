package com.pmatic.ccu.client.api.exception;

/**
 * The exception thrown when an operation of the CCU client fails.
 * <p>
 * It's the base class for all client exceptions. Transport specific exceptions never
 * reach the caller, they are translated into one of the subclasses.
 */
public abstract class ClientException extends Exception {

    private static final long serialVersionUID = 6338133491680948104L;

    protected ClientException(String message, Throwable cause) {
        super(message, cause);
    }

    protected ClientException(String message) {
        super(message);
    }

    /**
     * @return the category of this failure.
     */
    public abstract ErrorKind getKind();
}
