package com.pmatic.ccu.client;

import com.pmatic.ccu.client.api.CcuClient;
import com.pmatic.ccu.client.api.ClientConfiguration;
import com.pmatic.ccu.client.api.MethodDescriptor;
import com.pmatic.ccu.client.api.RemoteMethod;
import com.pmatic.ccu.client.api.exception.ClientException;
import com.pmatic.ccu.client.api.exception.MethodNotFoundException;
import com.pmatic.ccu.client.route.Address;
import com.pmatic.ccu.client.transport.RemotingException;
import com.pmatic.ccu.client.transport.RpcTransportFactory;
import com.pmatic.ccu.client.transport.xmlrpc.XmlRpcTransportFactory;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.concurrent.locks.Lock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

public class DefaultCcuClient implements CcuClient {
    private static final Logger log = LoggerFactory.getLogger(DefaultCcuClient.class);
    private static final String LINE_FORMAT = "%-60s %s%n";
    private static final Object[] NO_ARGS = new Object[0];

    private final ConnectionManager connectionManager;

    public DefaultCcuClient(ClientConfiguration configuration) {
        this(configuration, new XmlRpcTransportFactory());
    }

    public DefaultCcuClient(ClientConfiguration configuration, RpcTransportFactory transportFactory) {
        checkNotNull(configuration, "configuration should not be null");
        checkNotNull(transportFactory, "transportFactory should not be null");
        this.connectionManager = new ConnectionManager(configuration, transportFactory);
    }

    @Override
    public Object invoke(String methodName, Object... args) throws ClientException {
        checkNotNull(methodName, "methodName should not be null");
        Lock lock = connectionManager.getLock();
        lock.lock();
        try {
            connectionManager.ensureReady();
            return doCall(methodName, resolve(methodName), args == null ? NO_ARGS : args);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public RemoteMethod method(String methodName) throws ClientException {
        checkNotNull(methodName, "methodName should not be null");
        Lock lock = connectionManager.getLock();
        lock.lock();
        try {
            connectionManager.ensureReady();
            return new BoundMethod(methodName, resolve(methodName));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public SortedMap<String, MethodDescriptor> methods() throws ClientException {
        Lock lock = connectionManager.getLock();
        lock.lock();
        try {
            connectionManager.ensureReady();
            return connectionManager.catalog().snapshot();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void printMethods(PrintStream out) throws ClientException {
        SortedMap<String, MethodDescriptor> methods = methods();
        out.printf(LINE_FORMAT, "Method", "Description");
        for (Map.Entry<String, MethodDescriptor> entry : methods.entrySet()) {
            MethodDescriptor method = entry.getValue();
            String call = entry.getKey() + "(" + String.join(", ", method.internalArguments()) + ")";
            out.printf(LINE_FORMAT, call, method.description());
        }
        out.flush();
    }

    @Override
    public boolean isInitialized() {
        return connectionManager.isInitialized();
    }

    @Override
    public Optional<Exception> getFailReason() {
        return connectionManager.getFailReason();
    }

    @Override
    public Address getAddress() {
        return connectionManager.getConfiguration().getAddress();
    }

    private MethodDescriptor resolve(String methodName) throws MethodNotFoundException {
        return connectionManager.catalog().find(methodName)
            .orElseThrow(() -> new MethodNotFoundException(methodName));
    }

    private Object doCall(String methodName, MethodDescriptor method, Object[] args) throws ClientException {
        String address = getAddress().getAddress();
        if (log.isDebugEnabled()) {
            log.debug("CALL: {} MODE: XML-RPC METHOD: {} ARGS: {}", address, method.remoteName(), Arrays.deepToString(args));
        }

        Object result;
        try {
            result = connectionManager.transport().invoke(method.remoteName(), args);
        } catch (RemotingException e) {
            throw RemotingErrors.translate(address, methodName, e);
        }

        if (log.isDebugEnabled()) {
            log.debug("  RESPONSE: {}", result instanceof Object[] ? Arrays.deepToString((Object[]) result) : result);
        }
        return result;
    }

    private class BoundMethod implements RemoteMethod {
        private final String localName;
        private final MethodDescriptor descriptor;

        BoundMethod(String localName, MethodDescriptor descriptor) {
            this.localName = localName;
            this.descriptor = descriptor;
        }

        @Override
        public String localName() {
            return localName;
        }

        @Override
        public MethodDescriptor descriptor() {
            return descriptor;
        }

        @Override
        public Object call(Object... args) throws ClientException {
            return invoke(localName, args);
        }

        @Override
        public String toString() {
            return "RemoteMethod(" + localName + " -> " + descriptor.remoteName() + ")";
        }
    }
}
