package com.pmatic.ccu.client.api;

import com.pmatic.ccu.client.api.exception.ConfigurationException;
import com.pmatic.ccu.client.route.Address;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

public class ClientConfiguration {
    public static final String ADDRESS = "address";
    public static final String CONNECT_TIMEOUT = "connect_timeout";
    public static final String REPLY_TIMEOUT = "reply_timeout";
    public static final String USERNAME = "username";
    public static final String PASSWORD = "password";

    private final Address address;
    private final Duration connectionTimeout;
    /**
     * How long to wait for the answer of a call. {@code 0} waits forever.
     */
    private final Duration replyTimeout;
    private final String basicUserName;
    private final String basicPassword;
    private final String encoding;

    ClientConfiguration(Address address, Duration connectionTimeout, Duration replyTimeout,
        String basicUserName, String basicPassword, String encoding) {
        this.address = address;
        this.connectionTimeout = connectionTimeout;
        this.replyTimeout = replyTimeout;
        this.basicUserName = basicUserName;
        this.basicPassword = basicPassword;
        this.encoding = encoding;
    }

    public static ClientConfigurationBuilder newBuilder() {
        return new ClientConfigurationBuilder();
    }

    /**
     * Build a configuration from loosely typed options, e.g. read from a config file.
     * <p>
     * Known keys are {@value #ADDRESS} (required), {@value #CONNECT_TIMEOUT} and {@value #REPLY_TIMEOUT}
     * in seconds, {@value #USERNAME} and {@value #PASSWORD}. Unknown keys are ignored.
     *
     * @param options the options.
     * @return the configuration.
     * @throws ConfigurationException if the address is missing or not a string, or a value has the wrong type.
     */
    public static ClientConfiguration fromOptions(Map<String, ?> options) throws ConfigurationException {
        Object address = options.get(ADDRESS);
        if (!(address instanceof String)) {
            throw new ConfigurationException("You need to provide at least the address to access your CCU via XML-RPC.");
        }
        ClientConfigurationBuilder builder = newBuilder().setAddress((String) address);
        Optional<Duration> connectTimeout = seconds(options, CONNECT_TIMEOUT);
        if (connectTimeout.isPresent()) {
            builder.setConnectionTimeout(connectTimeout.get());
        }
        Optional<Duration> replyTimeout = seconds(options, REPLY_TIMEOUT);
        if (replyTimeout.isPresent()) {
            builder.setReplyTimeout(replyTimeout.get());
        }
        Object username = options.get(USERNAME);
        if (username != null) {
            builder.setBasicUserName(username.toString());
        }
        Object password = options.get(PASSWORD);
        if (password != null) {
            builder.setBasicPassword(password.toString());
        }
        return builder.build();
    }

    private static Optional<Duration> seconds(Map<String, ?> options, String key) throws ConfigurationException {
        Object value = options.get(key);
        if (value == null) {
            return Optional.empty();
        }
        try {
            double seconds = value instanceof Number ? ((Number) value).doubleValue() : Double.parseDouble(value.toString());
            if (seconds < 0) {
                throw new ConfigurationException("Option " + key + " must not be negative: " + value);
            }
            return Optional.of(Duration.ofMillis(Math.round(seconds * 1000)));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Option " + key + " is not a number: " + value, e);
        }
    }

    public Address getAddress() {
        return address;
    }

    public Duration getConnectionTimeout() {
        return connectionTimeout;
    }

    public Duration getReplyTimeout() {
        return replyTimeout;
    }

    public Optional<String> getBasicUserName() {
        return Optional.ofNullable(basicUserName);
    }

    public Optional<String> getBasicPassword() {
        return Optional.ofNullable(basicPassword);
    }

    public String getEncoding() {
        return encoding;
    }
}
