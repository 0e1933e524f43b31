package com.pmatic.ccu.client.api.exception;

/**
 * Category of a {@link ClientException}, so callers can branch on the kind of failure
 * without depending on the exception class hierarchy.
 */
public enum ErrorKind {
    /**
     * Invalid construction input. Not retried.
     */
    CONFIGURATION,
    /**
     * The transport could not be opened or failed during a call.
     */
    CONNECTION,
    /**
     * The controller understood the request and answered with a fault.
     */
    PROTOCOL,
    /**
     * The requested local method name is unknown to the controller.
     */
    METHOD_NOT_FOUND
}
