package com.pmatic.ccu.client;

import com.pmatic.ccu.client.api.ClientConfiguration;
import com.pmatic.ccu.client.api.exception.ClientException;
import com.pmatic.ccu.client.catalog.MethodCatalog;
import com.pmatic.ccu.client.transport.RemotingException;
import com.pmatic.ccu.client.transport.RpcTransport;
import com.pmatic.ccu.client.transport.RpcTransportFactory;
import com.pmatic.ccu.client.utils.NameTranslator;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkState;

/**
 * Owns the transport to the CCU and the catalog of its methods.
 * <p>
 * Both are set up lazily by {@link #ensureReady()}. The client is either uninitialized, or ready
 * after the transport has been opened and the catalog has been populated. A failed attempt leaves
 * the client uninitialized and records the failure, the next attempt starts from scratch.
 * <p>
 * All access to the transport and the catalog happens with {@link #getLock()} held.
 */
class ConnectionManager {
    static final String INTROSPECTION_METHOD = "system.listMethods";

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final ClientConfiguration configuration;
    private final RpcTransportFactory transportFactory;
    private final ReentrantLock lock = new ReentrantLock();
    private final MethodCatalog catalog = new MethodCatalog();

    private RpcTransport transport;
    private volatile boolean initialized = false;
    private volatile Exception failReason;

    ConnectionManager(ClientConfiguration configuration, RpcTransportFactory transportFactory) {
        this.configuration = configuration;
        this.transportFactory = transportFactory;
    }

    void ensureReady() throws ClientException {
        if (initialized) {
            return;
        }
        lock.lock();
        try {
            if (initialized) {
                return;
            }
            initialize();
        } finally {
            lock.unlock();
        }
    }

    private void initialize() throws ClientException {
        failReason = null;
        log.debug("[XML-API] Initializing {}...", configuration.getAddress());
        try {
            transport = transportFactory.open(configuration);
            catalog.rebuild(transport.listMethods());
            initialized = true;
            log.debug("[XML-API] Initialized, {} methods available", catalog.size());
        } catch (RemotingException e) {
            ClientException translated = RemotingErrors.translate(configuration.getAddress().getAddress(),
                NameTranslator.toLocalName(INTROSPECTION_METHOD), e);
            fail(translated);
            throw translated;
        } catch (RuntimeException e) {
            fail(e);
            throw e;
        }
    }

    private void fail(Exception e) {
        initialized = false;
        transport = null;
        failReason = e;
        log.warn("[XML-API] Failed to initialize {}: {}", configuration.getAddress(), e.getMessage());
    }

    boolean isInitialized() {
        return initialized;
    }

    Optional<Exception> getFailReason() {
        return Optional.ofNullable(failReason);
    }

    ClientConfiguration getConfiguration() {
        return configuration;
    }

    ReentrantLock getLock() {
        return lock;
    }

    RpcTransport transport() {
        checkState(lock.isHeldByCurrentThread(), "transport accessed without holding the lock");
        checkState(initialized, "transport accessed before initialization");
        return transport;
    }

    MethodCatalog catalog() {
        checkState(lock.isHeldByCurrentThread(), "catalog accessed without holding the lock");
        return catalog;
    }
}
