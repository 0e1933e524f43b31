package com.pmatic.ccu.client;

import com.google.common.base.Preconditions;
import com.pmatic.ccu.client.api.CcuClient;
import com.pmatic.ccu.client.api.ClientBuilder;
import com.pmatic.ccu.client.api.ClientConfiguration;
import com.pmatic.ccu.client.api.exception.ConfigurationException;
import com.pmatic.ccu.client.transport.RpcTransportFactory;
import com.pmatic.ccu.client.transport.xmlrpc.XmlRpcTransportFactory;

public class DefaultClientBuilder implements ClientBuilder {
    private ClientConfiguration clientConfiguration;
    private RpcTransportFactory transportFactory = new XmlRpcTransportFactory();

    @Override
    public ClientBuilder setClientConfiguration(ClientConfiguration clientConfiguration) {
        Preconditions.checkArgument(clientConfiguration != null, "clientConfiguration is null");
        this.clientConfiguration = clientConfiguration;
        return this;
    }

    @Override
    public ClientBuilder setTransportFactory(RpcTransportFactory transportFactory) {
        Preconditions.checkArgument(transportFactory != null, "transportFactory is null");
        this.transportFactory = transportFactory;
        return this;
    }

    @Override
    public CcuClient build() throws ConfigurationException {
        if (clientConfiguration == null) {
            throw new ConfigurationException("You need to provide at least the address to access your CCU via XML-RPC.");
        }
        return new DefaultCcuClient(clientConfiguration, transportFactory);
    }
}
