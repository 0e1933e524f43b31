package com.pmatic.ccu.client.route;

import com.pmatic.ccu.client.api.exception.ConfigurationException;
import com.pmatic.ccu.client.api.exception.ErrorKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class AddressTest {
    @Test
    public void testAddressWithoutScheme() throws ConfigurationException {
        Assertions.assertEquals("http://192.168.1.26:2001", Address.fromAddress("192.168.1.26").getAddress());
        Assertions.assertEquals("http://ccu.local:2001", Address.fromAddress("ccu.local").getAddress());
    }

    @Test
    @SuppressWarnings("HttpUrlsUsage")
    public void testAddressWithHttpPrefix() throws ConfigurationException {
        Assertions.assertEquals("http://ccu.local:2001", Address.fromAddress("http://ccu.local").getAddress());
    }

    @Test
    public void testAddressWithHttpsPrefix() throws ConfigurationException {
        Assertions.assertEquals("https://ccu.local:2001", Address.fromAddress("https://ccu.local").getAddress());
    }

    @Test
    public void testMissingAddress() {
        ConfigurationException e = Assertions.assertThrows(ConfigurationException.class, () -> Address.fromAddress(null));
        Assertions.assertEquals(ErrorKind.CONFIGURATION, e.getKind());
        Assertions.assertThrows(ConfigurationException.class, () -> Address.fromAddress("  "));
    }

    @Test
    public void testEquality() throws ConfigurationException {
        Assertions.assertEquals(Address.fromAddress("ccu.local"), Address.fromAddress("http://ccu.local"));
        Assertions.assertEquals("http://ccu.local:2001", Address.fromAddress("ccu.local").toString());
    }
}
