package com.pmatic.ccu.client.transport;

import java.util.List;

/**
 * Point-to-point remote procedure call channel to a CCU.
 * <p>
 * Implementations are not required to be thread safe, the client never calls a transport concurrently.
 */
public interface RpcTransport {
    /**
     * List the names of all methods offered by the remote endpoint.
     *
     * @return method names in the order reported by the endpoint.
     * @throws RemotingConnectException if the endpoint can not be reached.
     * @throws RemoteFaultException     if the endpoint answers with a fault.
     */
    List<String> listMethods() throws RemotingException;

    /**
     * Invokes a remote method synchronously.
     *
     * @param methodName untranslated name of the remote method.
     * @param args       positional arguments.
     * @return the raw result.
     * @throws RemotingConnectException if the endpoint can not be reached.
     * @throws RemoteFaultException     if the endpoint answers with a fault.
     */
    Object invoke(String methodName, Object... args) throws RemotingException;
}
