package com.pmatic.ccu.client.utils;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Translates raw API method names reported by the CCU into the local notation.
 * <p>
 * These modifications are made, in this order:
 * <ul>
 *     <li>{@code .} is replaced with {@code _}</li>
 *     <li>the whole string is transformed from camel case to lowercase + underscore notation</li>
 *     <li>{@code BidCoS} becomes {@code bidcos} and {@code ReGa} becomes {@code rega}</li>
 *     <li>doubled underscores are collapsed</li>
 * </ul>
 * e.g. {@code Interface.activateLinkParamset} is changed to {@code interface_activate_link_paramset}.
 */
public final class NameTranslator {
    private static final Pattern WORD_START = Pattern.compile("(.)([A-Z][a-z]+)");
    private static final Pattern LOWER_TO_UPPER = Pattern.compile("([a-z0-9])([A-Z])");

    private NameTranslator() {
    }

    public static String toLocalName(String remoteName) {
        Objects.requireNonNull(remoteName, "remoteName should not be null");
        return decamel(remoteName.replace('.', '_'))
            .replace("bid_co_s", "bidcos")
            .replace("re_ga", "rega")
            .replace("__", "_");
    }

    /**
     * Converts camel case to lowercase + underscore notation. A run of capitals followed by
     * a lowercase run starts a new segment at the last capital, e.g. {@code CCUSerial} becomes
     * {@code ccu_serial}.
     */
    static String decamel(String name) {
        String words = WORD_START.matcher(name).replaceAll("$1_$2");
        return LOWER_TO_UPPER.matcher(words).replaceAll("$1_$2").toLowerCase(Locale.ROOT);
    }
}
