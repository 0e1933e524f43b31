package com.pmatic.ccu.client.transport.xmlrpc;

import com.pmatic.ccu.client.api.ClientConfiguration;
import com.pmatic.ccu.client.transport.RemotingConnectException;
import com.pmatic.ccu.client.transport.RemotingException;
import com.pmatic.ccu.client.transport.RpcTransport;
import com.pmatic.ccu.client.transport.RpcTransportFactory;
import java.net.MalformedURLException;
import java.net.URL;
import org.apache.xmlrpc.client.XmlRpcClient;
import org.apache.xmlrpc.client.XmlRpcClientConfigImpl;

/**
 * Opens XML-RPC over HTTP transports, based on the Apache XML-RPC client.
 * <p>
 * Opening does not touch the network, the first request does.
 */
public class XmlRpcTransportFactory implements RpcTransportFactory {

    @Override
    public RpcTransport open(ClientConfiguration configuration) throws RemotingException {
        String address = configuration.getAddress().getAddress();
        URL serverUrl;
        try {
            serverUrl = new URL(address);
        } catch (MalformedURLException e) {
            throw new RemotingConnectException("invalid address " + address + ": " + e.getMessage(), e);
        }
        return open(serverUrl, configuration);
    }

    /**
     * Open a transport to an explicit URL, ignoring the address of the configuration.
     *
     * @param serverUrl     URL of the XML-RPC endpoint.
     * @param configuration timeouts, credentials and encoding.
     * @return the transport.
     */
    public RpcTransport open(URL serverUrl, ClientConfiguration configuration) {
        XmlRpcClientConfigImpl config = new XmlRpcClientConfigImpl();
        config.setServerURL(serverUrl);
        config.setConnectionTimeout(toMillis(configuration.getConnectionTimeout().toMillis()));
        config.setReplyTimeout(toMillis(configuration.getReplyTimeout().toMillis()));
        config.setEncoding(configuration.getEncoding());
        configuration.getBasicUserName().ifPresent(config::setBasicUserName);
        configuration.getBasicPassword().ifPresent(config::setBasicPassword);

        XmlRpcClient client = new XmlRpcClient();
        client.setConfig(config);
        return new XmlRpcTransport(serverUrl, client);
    }

    private static int toMillis(long millis) {
        return (int) Math.min(millis, Integer.MAX_VALUE);
    }
}
