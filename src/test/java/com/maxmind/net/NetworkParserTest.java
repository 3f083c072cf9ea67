package com.maxmind.net;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.OptionalInt;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

public class NetworkParserTest {

    static Stream<Arguments> validNetworks() {
        return Stream.of(
            Arguments.of("192.168.168.100/24", "192.168.168.0/24"),
            Arguments.of("192.168.168.100 24", "192.168.168.0/24"),
            Arguments.of("192.168.168.100 255.255.255.0", "192.168.168.0/24"),
            Arguments.of("192.168.168.100/255.255.255.0", "192.168.168.0/24"),
            Arguments.of("10.0.0.1", "10.0.0.0/8"),
            Arguments.of("172.16.5.4", "172.16.0.0/16"),
            Arguments.of("192.168.1.1", "192.168.1.0/24"),
            Arguments.of("0.0.0.0/0", "0.0.0.0/0"),
            Arguments.of("1.2.3.4/32", "1.2.3.4/32"),
            Arguments.of("2001:db8::1/64", "2001:db8::/64"),
            Arguments.of("2001:0DB8:0000::0001/48", "2001:db8::/48"),
            Arguments.of("2001:db8::1 ffff:ffff:ffff::", "2001:db8::/48"),
            Arguments.of("::/0", "::/0")
        );
    }

    @ParameterizedTest
    @MethodSource("validNetworks")
    public void testParse(String input, String expected) {
        var parser = new NetworkParser();

        assertEquals(expected, parser.parse(input).toString());
        assertEquals(expected, parser.tryParse(input).orElseThrow().toString());
    }

    @Test
    public void testSanitizedInput() {
        var network = Network.parse("  192.168.0.1 - 255.255.255.0  ");
        assertEquals("192.168.0.0/24", network.toString());

        assertEquals("10.1.0.0/16", Network.parse("\t10.1.2.3\n/\t16 ").toString());
        assertEquals("10.0.0.0/8", Network.parse("ip=10.1.2.3").toString());
    }

    @Test
    public void testWithoutSanitizing() {
        var parser = new NetworkParser(ClassfulCidrGuess.getInstance(), false);
        assertFalse(parser.isSanitizing());

        assertEquals("192.168.0.0/24", parser.parse("192.168.0.1/24").toString());
        assertThrows(MalformedAddressException.class, () -> parser.parse(" 192.168.0.1/24"));
        assertTrue(parser.tryParse("192.168.0.1 - 255.255.255.0").isEmpty());
        assertTrue(Network.tryParse("192.168.0.1 - 255.255.255.0", false).isEmpty());
        assertTrue(Network.tryParse("192.168.0.1 - 255.255.255.0", true).isPresent());
    }

    @Test
    public void testSeparateParts() {
        assertEquals("10.10.0.0/16", Network.parse("10.10.10.10", "255.255.0.0").toString());
        assertEquals("10.10.10.8/29", Network.parse("10.10.10.10", 29).toString());
        assertEquals("2001:db8::/32", Network.parse("2001:db8::1", 32).toString());

        assertTrue(Network.tryParse("10.10.10.10", 33).isEmpty());
        assertTrue(Network.tryParse("10.10.10.10", "255.0.255.0").isEmpty());
        assertTrue(Network.tryParse("10.10.10.10", "255.255.255.0").isPresent());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "!!!", "\t\n"})
    public void testEmptyInput(String input) {
        assertThrows(EmptyInputException.class, () -> Network.parse(input));
        assertTrue(Network.tryParse(input).isEmpty());
    }

    @Test
    public void testNullInput() {
        assertThrows(EmptyInputException.class, () -> Network.parse(null));
        assertThrows(EmptyInputException.class, () -> Network.parse(null, "255.255.255.0"));
        assertThrows(EmptyInputException.class, () -> Network.parse("10.0.0.1", (String) null));
        assertThrows(EmptyInputException.class, () -> Network.parse(null, 24));
        assertTrue(Network.tryParse(null).isEmpty());
    }

    @Test
    public void testMalformedAddress() {
        var ex = assertThrows(MalformedAddressException.class, () -> Network.parse("10.0.0/24"));
        assertThat(ex.getMessage(), containsString("10.0.0"));

        assertThrows(MalformedAddressException.class, () -> Network.parse("256.0.0.1/8"));
        assertThrows(MalformedAddressException.class, () -> Network.parse("abc"));
        assertThrows(MalformedAddressException.class, () -> Network.parse("10.0.0.1/24/8"));
        assertThrows(MalformedAddressException.class, () -> Network.parse("bad", "255.255.255.0"));
    }

    @Test
    public void testHostNamesAreNotResolved() {
        assertTrue(Network.tryParse("localhost/8", false).isEmpty());
        assertTrue(AddressCodec.tryParse("localhost").isEmpty());
    }

    @Test
    public void testMalformedNetmask() {
        var ex = assertThrows(MalformedNetmaskException.class, () -> Network.parse("10.0.0.1 255.255.0"));
        assertThat(ex.getMessage(), containsString("255.255.0"));

        assertThrows(MalformedNetmaskException.class, () -> Network.parse("10.0.0.1", "garbage"));
    }

    @Test
    public void testInvalidNetmask() {
        var ex = assertThrows(InvalidNetmaskException.class,
            () -> Network.parse("10.0.0.1 255.255.0.255"));
        assertThat(ex.getMessage(), containsString("255.255.0.255"));

        assertThrows(InvalidNetmaskException.class, () -> Network.parse("10.0.0.1", "0.0.0.255"));
    }

    @Test
    public void testMixedFamilyNetmask() {
        assertThrows(MixedAddressFamilyException.class, () -> Network.parse("10.0.0.1 ffff:ffff::"));
        assertThrows(MixedAddressFamilyException.class, () -> Network.parse("2001:db8::1", "255.255.255.0"));
    }

    @Test
    public void testPrefixOutOfRange() {
        assertThrows(PrefixOutOfRangeException.class, () -> Network.parse("10.0.0.1/33"));
        assertThrows(PrefixOutOfRangeException.class, () -> Network.parse("2001:db8::/129"));
        assertThrows(PrefixOutOfRangeException.class, () -> Network.parse("10.0.0.1/255"));
        assertTrue(Network.tryParse("10.0.0.1/33").isEmpty());
    }

    @Test
    public void testLargeNumberIsReadAsNetmask() {
        // 256 does not fit in a byte, so it is not a prefix length.
        assertThrows(MalformedNetmaskException.class, () -> Network.parse("10.0.0.1/256"));
    }

    @Test
    public void testUnguessableLength() {
        var ex = assertThrows(UnguessableLengthException.class, () -> Network.parse("224.0.0.1"));
        assertThat(ex.getMessage(), containsString("224.0.0.1"));

        assertThrows(UnguessableLengthException.class, () -> Network.parse("2001:db8::1"));
        assertTrue(Network.tryParse("240.0.0.1").isEmpty());
    }

    @Test
    public void testClasslessGuess() {
        var parser = new NetworkParser(ClasslessCidrGuess.getInstance());
        assertSame(ClasslessCidrGuess.getInstance(), parser.cidrGuess());

        assertEquals("10.1.2.3/32", parser.parse("10.1.2.3").toString());
        assertEquals("2001:db8::1/128", parser.parse("2001:db8::1").toString());
        assertEquals("224.0.0.1/32", Network.parse("224.0.0.1", ClasslessCidrGuess.getInstance()).toString());
        assertEquals("10.1.2.0/24", Network.parse("10.1.2.3/24", ClasslessCidrGuess.getInstance()).toString());
    }

    @Test
    public void testCustomGuess() {
        CidrGuess slash30 = address -> OptionalInt.of(30);

        assertEquals("10.1.2.0/30", Network.parse("10.1.2.3", slash30).toString());
        assertEquals("10.1.2.0/30", Network.parse(" 10.1.2.3 ", slash30, true).toString());
        assertTrue(Network.tryParse(" 10.1.2.3 ", slash30, false).isEmpty());
        assertTrue(Network.tryParse("10.1.2.3", slash30).isPresent());

        CidrGuess never = address -> OptionalInt.empty();
        assertThrows(UnguessableLengthException.class, () -> Network.parse("10.1.2.3", never));
        assertTrue(Network.tryParse("10.1.2.3", never, true).isEmpty());
    }

    @Test
    public void testGuessOutOfRange() {
        CidrGuess tooLong = address -> OptionalInt.of(40);
        assertThrows(PrefixOutOfRangeException.class, () -> Network.parse("10.1.2.3", tooLong));
    }

    @Test
    public void testNullGuess() {
        assertThrows(NullPointerException.class, () -> new NetworkParser(null));
    }

    @Test
    public void testSanitize() {
        assertEquals("10.0.0.1 255.0.0.0", NetworkParser.sanitize(" 10.0.0.1 -\t255.0.0.0 "));
        assertEquals("2001:db8::/32", NetworkParser.sanitize("[2001:db8::/32]"));
        assertEquals("", NetworkParser.sanitize("!!"));
    }
}
