package com.pmatic.ccu.client.api;

import com.pmatic.ccu.client.api.exception.ConfigurationException;
import com.pmatic.ccu.client.transport.RpcTransportFactory;

public interface ClientBuilder {
    ClientBuilder setClientConfiguration(ClientConfiguration clientConfiguration);

    /**
     * Replace the transport, XML-RPC over HTTP by default.
     */
    ClientBuilder setTransportFactory(RpcTransportFactory transportFactory);

    /**
     * Build the client. Does not connect, the connection is established lazily on first use.
     *
     * @return the client.
     * @throws ConfigurationException if no configuration has been set.
     */
    CcuClient build() throws ConfigurationException;
}
