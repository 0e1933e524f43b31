package com.pmatic.ccu.client.api.exception;

/**
 * Thrown when the controller answers a call with a fault response.
 */
public class ProtocolException extends ClientException {

    private static final long serialVersionUID = -5611908337466401522L;

    private final String methodName;
    private final int faultCode;

    public ProtocolException(String methodName, int faultCode, String message, Throwable cause) {
        super(message, cause);
        this.methodName = methodName;
        this.faultCode = faultCode;
    }

    /**
     * @return the local name of the method that was called.
     */
    public String getMethodName() {
        return methodName;
    }

    public int getFaultCode() {
        return faultCode;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.PROTOCOL;
    }
}
