package com.pmatic.ccu.client.route;

import com.pmatic.ccu.client.api.exception.ConfigurationException;

/**
 * Normalized address of the XML-RPC interface of a CCU.
 * <p>
 * The XML-RPC interface listens on a fixed port. Addresses without a protocol prefix get
 * {@code http://} prepended, the port is always appended.
 */
public final class Address {
    public static final int XML_RPC_PORT = 2001;

    private static final String HTTP_PREFIX = "http://";
    private static final String HTTPS_PREFIX = "https://";

    private final String address;

    private Address(String address) {
        this.address = address;
    }

    /**
     * Create an address from the raw value given by the user.
     *
     * @param address host name, IP address or URL without port, like {@code 192.168.1.26}
     *                or {@code https://ccu.local}.
     * @return the normalized address.
     * @throws ConfigurationException if the address is missing or empty.
     */
    public static Address fromAddress(String address) throws ConfigurationException {
        if (address == null || address.isBlank()) {
            throw new ConfigurationException("Please specify the address of the CCU.");
        }
        return new Address(normalize(address));
    }

    static String normalize(String address) {
        if (address.startsWith(HTTPS_PREFIX) || address.startsWith(HTTP_PREFIX)) {
            return address + ":" + XML_RPC_PORT;
        }
        return HTTP_PREFIX + address + ":" + XML_RPC_PORT;
    }

    public String getAddress() {
        return address;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return address.equals(((Address) o).address);
    }

    @Override
    public int hashCode() {
        return address.hashCode();
    }

    @Override
    public String toString() {
        return address;
    }
}
