package com.maxmind.net;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class AddressCodecTest {

    @Test
    public void testToBigInteger() throws UnknownHostException {
        assertEquals(BigInteger.valueOf(0xFFFFFFFFL), AddressCodec.toBigInteger("255.255.255.255"));
        assertEquals(BigInteger.valueOf(0xC0A80001L), AddressCodec.toBigInteger(InetAddress.getByName("192.168.0.1")));
        assertEquals(BigInteger.ONE, AddressCodec.toBigInteger("::1"));
        assertEquals(BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE),
            AddressCodec.toBigInteger("ffff:ffff:ffff:ffff:ffff:ffff:ffff:ffff"));
        assertEquals(BigInteger.ZERO, AddressCodec.tryToBigInteger("0.0.0.0").orElseThrow());
    }

    @Test
    public void testFromBigInteger() {
        assertEquals("10.0.0.1", AddressCodec.fromBigInteger(BigInteger.valueOf(0x0A000001L), AddressFamily.IPV4)
            .getHostAddress());
        assertEquals("::1", AddressCodec.toString(AddressCodec.fromBigInteger(BigInteger.ONE, AddressFamily.IPV6)));
        assertEquals("0.0.0.0", AddressCodec.fromBigInteger(BigInteger.ZERO, AddressFamily.IPV4).getHostAddress());
    }

    @Test
    public void testFromBigIntegerTruncatesToFamilyWidth() {
        var value = BigInteger.ONE.shiftLeft(32).add(BigInteger.valueOf(5));

        assertEquals("0.0.0.5", AddressCodec.fromBigInteger(value, AddressFamily.IPV4).getHostAddress());
    }

    @Test
    public void testMappedAddressStaysIPv6() {
        var value = BigInteger.valueOf(0xFFFF0A000001L);
        var address = AddressCodec.fromBigInteger(value, AddressFamily.IPV6);

        assertTrue(address instanceof Inet6Address);
        assertEquals(AddressFamily.IPV6, AddressFamily.of(address));
        assertEquals(value, AddressCodec.toBigInteger(address));
    }

    @Test
    public void testMappedTextStaysIPv6() {
        var address = AddressCodec.parse("::ffff:10.0.0.1");

        assertTrue(address instanceof Inet6Address);
        assertEquals(BigInteger.valueOf(0xFFFF0A000001L), AddressCodec.toBigInteger(address));
        assertEquals(BigInteger.valueOf(0xFFFF0A000001L), AddressCodec.toBigInteger("::ffff:a00:1"));
        assertEquals(address, AddressCodec.parse(AddressCodec.toString(address)));
        assertEquals(AddressFamily.IPV6, AddressFamily.of(AddressCodec.tryParse("::ffff:0:0").orElseThrow()));
        assertEquals(AddressFamily.IPV4, AddressFamily.of(AddressCodec.parse("10.0.0.1")));
    }

    @Test
    public void testNegativeValue() {
        assertThrows(IllegalArgumentException.class,
            () -> AddressCodec.fromBigInteger(BigInteger.valueOf(-1), AddressFamily.IPV4));
    }

    @Test
    public void testCanonicalText() {
        assertEquals("2001:db8::1", AddressCodec.toString(AddressCodec.parse("2001:0DB8:0:0:0:0:0:1")));
        assertEquals("2001:db8:0:1:1:1:1:1", AddressCodec.toString(AddressCodec.parse("2001:db8::1:1:1:1:1")));
        assertEquals("2001:db8::1:0:0:1", AddressCodec.toString(AddressCodec.parse("2001:db8:0:0:1:0:0:1")));
        assertEquals("10.1.2.3", AddressCodec.toString(AddressCodec.parse("10.1.2.3")));
    }

    @ParameterizedTest
    @ValueSource(strings = {"1.2.3", "1.2.3.256", "example.com", "localhost", "2001:db8:::1", "10.0.0.1/8"})
    public void testMalformed(String address) {
        assertThrows(MalformedAddressException.class, () -> AddressCodec.parse(address));
        assertThrows(MalformedAddressException.class, () -> AddressCodec.toBigInteger(address));
        assertTrue(AddressCodec.tryParse(address).isEmpty());
        assertTrue(AddressCodec.tryToBigInteger(address).isEmpty());
    }

    @Test
    public void testEmpty() {
        assertThrows(EmptyInputException.class, () -> AddressCodec.parse(""));
        assertThrows(EmptyInputException.class, () -> AddressCodec.parse(null));
        assertTrue(AddressCodec.tryParse(null).isEmpty());
        assertThrows(NullPointerException.class, () -> AddressCodec.toBigInteger((InetAddress) null));
        assertThrows(NullPointerException.class, () -> AddressFamily.of(null));
    }
}
