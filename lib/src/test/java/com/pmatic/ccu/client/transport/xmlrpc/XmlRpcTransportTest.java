package com.pmatic.ccu.client.transport.xmlrpc;

import com.pmatic.ccu.client.DefaultClientBuilder;
import com.pmatic.ccu.client.api.CcuClient;
import com.pmatic.ccu.client.api.ClientConfiguration;
import com.pmatic.ccu.client.api.exception.ProtocolException;
import com.pmatic.ccu.client.transport.RemoteFaultException;
import com.pmatic.ccu.client.transport.RemotingConnectException;
import com.pmatic.ccu.client.transport.RemotingException;
import com.pmatic.ccu.client.transport.RpcTransport;
import java.io.IOException;
import java.net.ServerSocket;
import java.net.SocketTimeoutException;
import java.net.URL;
import java.time.Duration;
import java.util.List;
import org.apache.xmlrpc.XmlRpcException;
import org.apache.xmlrpc.metadata.XmlRpcSystemImpl;
import org.apache.xmlrpc.server.PropertyHandlerMapping;
import org.apache.xmlrpc.webserver.WebServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class XmlRpcTransportTest {
    private static WebServer webServer;
    private static URL serverUrl;
    private static ClientConfiguration clientConfiguration;

    private final XmlRpcTransportFactory transportFactory = new XmlRpcTransportFactory();
    private RpcTransport transport;

    @BeforeAll
    static void beforeAll() throws Exception {
        int port = freePort();
        webServer = new WebServer(port);
        PropertyHandlerMapping handlerMapping = new PropertyHandlerMapping();
        handlerMapping.addHandler("CCU", CcuHandler.class);
        XmlRpcSystemImpl.addSystemHandler(handlerMapping);
        webServer.getXmlRpcServer().setHandlerMapping(handlerMapping);
        webServer.start();

        serverUrl = new URL("http://127.0.0.1:" + port + "/RPC2");
        clientConfiguration = ClientConfiguration.newBuilder()
            .setAddress("127.0.0.1")
            .setConnectionTimeout(Duration.ofSeconds(3))
            .setReplyTimeout(Duration.ofSeconds(10))
            .build();
    }

    @AfterAll
    static void afterAll() {
        if (webServer != null) {
            webServer.shutdown();
        }
    }

    @BeforeEach
    void setUp() {
        transport = transportFactory.open(serverUrl, clientConfiguration);
    }

    @Test
    void listMethods() throws RemotingException {
        List<String> methods = transport.listMethods();

        assertTrue(methods.contains("CCU.getSerial"));
        assertTrue(methods.contains("CCU.add"));
        assertTrue(methods.contains("system.listMethods"));
    }

    @Test
    void invoke() throws RemotingException {
        assertEquals("KEQ0123456", transport.invoke("CCU.getSerial"));
        assertEquals(5, transport.invoke("CCU.add", 2, 3));
    }

    @Test
    void faultAnswer() {
        RemoteFaultException e = assertThrows(RemoteFaultException.class, () -> transport.invoke("CCU.fail"));
        assertEquals(42, e.getFaultCode());
        assertEquals("boom", e.getMessage());
    }

    @Test
    void unknownRemoteMethod() {
        assertThrows(RemoteFaultException.class, () -> transport.invoke("CCU.noSuchMethod"));
    }

    @Test
    void connectionRefused() throws Exception {
        RpcTransport unreachable = transportFactory.open(new URL("http://127.0.0.1:" + freePort() + "/"), clientConfiguration);

        assertThrows(RemotingConnectException.class, unreachable::listMethods);
    }

    @Test
    void classifyIoFailure() {
        XmlRpcTransport xmlRpcTransport = (XmlRpcTransport) transport;

        RemotingException timeout = xmlRpcTransport.classify(
            new XmlRpcException("Failed to read server's response: Read timed out", new SocketTimeoutException("Read timed out")));
        assertInstanceOf(RemotingConnectException.class, timeout);

        RemotingException fault = xmlRpcTransport.classify(new XmlRpcException(7, "Unknown parameter"));
        assertInstanceOf(RemoteFaultException.class, fault);
        assertEquals(7, ((RemoteFaultException) fault).getFaultCode());
    }

    @Test
    void malformedAddress() throws Exception {
        ClientConfiguration configuration = ClientConfiguration.newBuilder().setAddress("ccu.local:").build();

        assertThrows(RemotingConnectException.class, () -> transportFactory.open(configuration));
    }

    @Test
    void clientOverXmlRpc() throws Exception {
        CcuClient client = new DefaultClientBuilder()
            .setClientConfiguration(clientConfiguration)
            .setTransportFactory(configuration -> transportFactory.open(serverUrl, configuration))
            .build();

        assertEquals("KEQ0123456", client.invoke("ccu_get_serial"));
        assertEquals(7, client.method("ccu_add").call(3, 4));
        ProtocolException e = assertThrows(ProtocolException.class, () -> client.invoke("ccu_fail"));
        assertEquals("ccu_fail", e.getMethodName());
        assertEquals(42, e.getFaultCode());
    }

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    public static class CcuHandler {
        public String getSerial() {
            return "KEQ0123456";
        }

        public int add(int a, int b) {
            return a + b;
        }

        public int fail() throws XmlRpcException {
            throw new XmlRpcException(42, "boom");
        }
    }
}
