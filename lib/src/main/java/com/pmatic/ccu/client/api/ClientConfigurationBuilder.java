package com.pmatic.ccu.client.api;

import com.pmatic.ccu.client.api.exception.ConfigurationException;
import com.pmatic.ccu.client.route.Address;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

public class ClientConfigurationBuilder {
    private String address;
    private Duration connectionTimeout = Duration.ofSeconds(10);
    private Duration replyTimeout = Duration.ZERO;
    private String basicUserName;
    private String basicPassword;
    private String encoding = StandardCharsets.UTF_8.name();

    /**
     * Set the address of the CCU.
     * @param address host name or IP address of the CCU, optionally prefixed with "http://" or "https://".
     * @return the client configuration builder instance.
     */
    public ClientConfigurationBuilder setAddress(String address) {
        this.address = address;
        return this;
    }

    /**
     * Set the connection timeout.
     * @param timeout timeout
     * @return the client configuration builder instance.
     */
    public ClientConfigurationBuilder setConnectionTimeout(Duration timeout) {
        checkNotNull(timeout, "connectionTimeout should not be null");
        checkArgument(!timeout.isNegative(), "connectionTimeout should not be negative");
        this.connectionTimeout = timeout;
        return this;
    }

    /**
     * Set the reply timeout. {@link Duration#ZERO} waits forever.
     * @param timeout timeout
     * @return the client configuration builder instance.
     */
    public ClientConfigurationBuilder setReplyTimeout(Duration timeout) {
        checkNotNull(timeout, "replyTimeout should not be null");
        checkArgument(!timeout.isNegative(), "replyTimeout should not be negative");
        this.replyTimeout = timeout;
        return this;
    }

    /**
     * Set the user name for HTTP basic authentication.
     * @param basicUserName user name.
     * @return the client configuration builder instance.
     */
    public ClientConfigurationBuilder setBasicUserName(String basicUserName) {
        this.basicUserName = basicUserName;
        return this;
    }

    /**
     * Set the password for HTTP basic authentication.
     * @param basicPassword password.
     * @return the client configuration builder instance.
     */
    public ClientConfigurationBuilder setBasicPassword(String basicPassword) {
        this.basicPassword = basicPassword;
        return this;
    }

    public ClientConfigurationBuilder setEncoding(String encoding) {
        checkNotNull(encoding, "encoding should not be null");
        this.encoding = encoding;
        return this;
    }

    /**
     * Build the client configuration.
     * @return the client configuration.
     * @throws ConfigurationException if no address has been set.
     */
    public ClientConfiguration build() throws ConfigurationException {
        return new ClientConfiguration(Address.fromAddress(address), connectionTimeout, replyTimeout,
            basicUserName, basicPassword, encoding);
    }
}
