package com.pmatic.ccu.client;

import com.pmatic.ccu.client.transport.RemoteFaultException;
import com.pmatic.ccu.client.transport.RemotingException;
import com.pmatic.ccu.client.transport.RpcTransport;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory transport recording every interaction, and how many of them overlapped.
 */
class FakeTransport implements RpcTransport {
    interface Handler {
        Object handle(Object[] args) throws RemotingException;
    }

    private final List<String> methods;
    private final Map<String, Handler> handlers = new HashMap<>();
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private final List<Object[]> arguments = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger listMethodsCalls = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    FakeTransport(List<String> methods) {
        this.methods = methods;
    }

    FakeTransport on(String remoteName, Handler handler) {
        handlers.put(remoteName, handler);
        return this;
    }

    @Override
    public List<String> listMethods() throws RemotingException {
        enter();
        try {
            listMethodsCalls.incrementAndGet();
            return methods;
        } finally {
            leave();
        }
    }

    @Override
    public Object invoke(String methodName, Object... args) throws RemotingException {
        enter();
        try {
            calls.add(methodName);
            arguments.add(args);
            Handler handler = handlers.get(methodName);
            if (handler == null) {
                throw new RemoteFaultException(-1, "no handler for " + methodName, null);
            }
            return handler.handle(args);
        } finally {
            leave();
        }
    }

    private void enter() {
        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);
    }

    private void leave() {
        inFlight.decrementAndGet();
    }

    List<String> calls() {
        return calls;
    }

    List<Object[]> arguments() {
        return arguments;
    }

    int listMethodsCalls() {
        return listMethodsCalls.get();
    }

    int maxInFlight() {
        return maxInFlight.get();
    }
}
