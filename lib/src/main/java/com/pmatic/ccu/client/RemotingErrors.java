package com.pmatic.ccu.client;

import com.pmatic.ccu.client.api.exception.ClientException;
import com.pmatic.ccu.client.api.exception.ConnectionException;
import com.pmatic.ccu.client.api.exception.ProtocolException;
import com.pmatic.ccu.client.transport.RemoteFaultException;
import com.pmatic.ccu.client.transport.RemotingException;

/**
 * Translates transport failures into client exceptions.
 */
final class RemotingErrors {
    private RemotingErrors() {
    }

    static ClientException translate(String address, String methodName, RemotingException e) {
        if (e instanceof RemoteFaultException) {
            RemoteFaultException fault = (RemoteFaultException) e;
            return new ProtocolException(methodName, fault.getFaultCode(),
                "Server error calling \"" + methodName + "\": " + fault, fault);
        }
        return new ConnectionException(address, "Unable to open \"" + address + "\": " + e.getMessage(), e);
    }
}
