package com.pmatic.ccu.client.transport;

/**
 * The remote endpoint answered with a fault response.
 */
public class RemoteFaultException extends RemotingException {

    private static final long serialVersionUID = 2870418539270853215L;

    private final int faultCode;

    public RemoteFaultException(int faultCode, String faultString, Throwable cause) {
        super(faultString, cause);
        this.faultCode = faultCode;
    }

    public int getFaultCode() {
        return faultCode;
    }

    @Override
    public String toString() {
        return "<Fault " + faultCode + ": " + getMessage() + ">";
    }
}
