package com.pmatic.ccu.client.api;

import com.pmatic.ccu.client.api.exception.ClientException;

/**
 * A method of the CCU, resolved by {@link CcuClient#method(String)}.
 */
public interface RemoteMethod {
    String localName();

    MethodDescriptor descriptor();

    /**
     * Invokes the method synchronously.
     *
     * @param args positional arguments.
     * @return the raw result.
     * @throws ClientException on any failure.
     */
    Object call(Object... args) throws ClientException;
}
