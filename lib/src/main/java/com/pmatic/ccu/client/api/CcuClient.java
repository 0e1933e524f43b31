package com.pmatic.ccu.client.api;

import com.pmatic.ccu.client.api.exception.ClientException;
import com.pmatic.ccu.client.route.Address;
import java.io.PrintStream;
import java.util.Optional;
import java.util.SortedMap;

/**
 * Low level client of the XML-RPC API of a CCU.
 * <p>
 * The methods offered by the CCU are not known in advance. They are fetched from the CCU on first use
 * and made available under their local name, e.g. {@code CCU.getSerial} is called as
 * {@code invoke("ccu_get_serial")}. Results are returned as decoded by the transport, without
 * any interpretation.
 * <p>
 * Implementations are thread safe. Calls are serialized, at most one call is in flight per client.
 */
public interface CcuClient {
    /**
     * Invokes a method of the CCU synchronously. Connects to the CCU first if needed.
     *
     * @param methodName local name of the method.
     * @param args       positional arguments.
     * @return the raw result.
     * @throws ClientException on any failure, see {@link ClientException#getKind()}.
     */
    Object invoke(String methodName, Object... args) throws ClientException;

    /**
     * Resolve a method of the CCU. Connects to the CCU first if needed.
     *
     * @param methodName local name of the method.
     * @return a handle to call the method.
     * @throws ClientException if the client can not be initialized or the method does not exist.
     */
    RemoteMethod method(String methodName) throws ClientException;

    /**
     * Methods offered by the CCU. Connects to the CCU first if needed.
     *
     * @return local names and descriptors, sorted by local name.
     * @throws ClientException if the client can not be initialized.
     */
    SortedMap<String, MethodDescriptor> methods() throws ClientException;

    /**
     * Prints a description of the available API methods. Connects to the CCU first if needed.
     *
     * @param out where to print to.
     * @throws ClientException if the client can not be initialized.
     */
    void printMethods(PrintStream out) throws ClientException;

    /**
     * Same as {@link #printMethods(PrintStream)}, printing to standard output.
     */
    default void printMethods() throws ClientException {
        printMethods(System.out);
    }

    /**
     * @return whether the connection with the CCU is ready for calls. Never connects.
     */
    boolean isInitialized();

    /**
     * @return the failure of the last initialization attempt, empty if it succeeded or never happened.
     */
    Optional<Exception> getFailReason();

    Address getAddress();
}
