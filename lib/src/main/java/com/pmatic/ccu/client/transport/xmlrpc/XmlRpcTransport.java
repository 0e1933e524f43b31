package com.pmatic.ccu.client.transport.xmlrpc;

import com.google.common.base.Throwables;
import com.pmatic.ccu.client.transport.RemoteFaultException;
import com.pmatic.ccu.client.transport.RemotingConnectException;
import com.pmatic.ccu.client.transport.RemotingException;
import com.pmatic.ccu.client.transport.RpcTransport;
import java.io.IOException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;
import org.apache.xmlrpc.XmlRpcException;
import org.apache.xmlrpc.client.XmlRpcClient;
import org.apache.xmlrpc.client.XmlRpcHttpTransportException;

public class XmlRpcTransport implements RpcTransport {
    static final String LIST_METHODS = "system.listMethods";

    private static final Object[] NO_ARGS = new Object[0];

    private final URL serverUrl;
    private final XmlRpcClient client;

    XmlRpcTransport(URL serverUrl, XmlRpcClient client) {
        this.serverUrl = serverUrl;
        this.client = client;
    }

    @Override
    public List<String> listMethods() throws RemotingException {
        Object result = execute(LIST_METHODS, NO_ARGS);
        if (!(result instanceof Object[])) {
            throw new RemoteFaultException(0, LIST_METHODS + " answered " + result + " instead of an array", null);
        }
        Object[] names = (Object[]) result;
        List<String> methods = new ArrayList<>(names.length);
        for (Object name : names) {
            methods.add(String.valueOf(name));
        }
        return methods;
    }

    @Override
    public Object invoke(String methodName, Object... args) throws RemotingException {
        return execute(methodName, args);
    }

    private Object execute(String methodName, Object[] args) throws RemotingException {
        try {
            return client.execute(methodName, args);
        } catch (XmlRpcException e) {
            throw classify(e);
        }
    }

    /**
     * HTTP level errors and I/O failures anywhere in the causal chain are connection failures,
     * everything else has been answered by the server.
     */
    RemotingException classify(XmlRpcException e) {
        if (e instanceof XmlRpcHttpTransportException) {
            XmlRpcHttpTransportException httpError = (XmlRpcHttpTransportException) e;
            return new RemotingConnectException("HTTP " + httpError.getStatusCode() + " "
                + httpError.getStatusMessage() + " from " + serverUrl, e);
        }
        for (Throwable cause : Throwables.getCausalChain(e)) {
            if (cause instanceof IOException) {
                return new RemotingConnectException(cause.getClass().getSimpleName() + ": " + cause.getMessage(), e);
            }
        }
        return new RemoteFaultException(e.code, e.getMessage(), e);
    }

    public URL getServerUrl() {
        return serverUrl;
    }
}
