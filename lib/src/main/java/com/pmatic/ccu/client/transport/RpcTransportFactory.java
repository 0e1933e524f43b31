package com.pmatic.ccu.client.transport;

import com.pmatic.ccu.client.api.ClientConfiguration;

@FunctionalInterface
public interface RpcTransportFactory {
    /**
     * Open a transport to the address of the given configuration.
     *
     * @param configuration client configuration.
     * @return the transport.
     * @throws RemotingConnectException if the transport can not be opened.
     */
    RpcTransport open(ClientConfiguration configuration) throws RemotingException;
}
