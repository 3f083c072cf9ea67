package com.maxmind.net;

import com.google.common.net.InetAddresses;
import java.math.BigInteger;
import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Optional;

/**
 * Conversions between {@link InetAddress} values, address literals and the
 * unsigned {@link BigInteger} form used for all address arithmetic.
 *
 * <p>Address text is only ever parsed as a literal. Host names are rejected
 * rather than resolved.</p>
 */
public final class AddressCodec {

    private static final BigInteger IPV4_MAPPED_PREFIX = BigInteger.valueOf(0xFFFFL).shiftLeft(32);

    private AddressCodec() {
    }

    /**
     * @param address an IPv4 or IPv6 address
     * @return the big-endian, non-negative integer value of the address.
     */
    public static BigInteger toBigInteger(InetAddress address) {
        if (address == null) {
            throw new NullPointerException("Address cannot be null");
        }
        return new BigInteger(1, address.getAddress());
    }

    /**
     * @param address an IPv4 or IPv6 address literal
     * @return the integer value of the address.
     * @throws EmptyInputException     if the address is null or empty.
     * @throws MalformedAddressException if the text is not an address literal.
     */
    public static BigInteger toBigInteger(String address) {
        return parseAddress(address).map(AddressCodec::toBigInteger).getOrThrow();
    }

    /**
     * @param address an IPv4 or IPv6 address literal
     * @return the integer value of the address, or empty if the text is not
     *         an address literal.
     */
    public static Optional<BigInteger> tryToBigInteger(String address) {
        return parseAddress(address).map(AddressCodec::toBigInteger).toOptional();
    }

    /**
     * Converts an integer back to an address. Values wider than the family
     * are truncated to their low-order bytes; narrower values are zero-padded.
     *
     * @param value  a non-negative integer
     * @param family the family of the resulting address
     * @return the address.
     */
    public static InetAddress fromBigInteger(BigInteger value, AddressFamily family) {
        if (family == null) {
            throw new NullPointerException("Address family cannot be null");
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Address value cannot be negative: " + value);
        }
        int width = family.byteLength();
        byte[] raw = value.toByteArray();
        byte[] bytes = new byte[width];
        int copy = Math.min(raw.length, width);
        System.arraycopy(raw, raw.length - copy, bytes, width - copy, copy);
        try {
            if (family == AddressFamily.IPV6) {
                // InetAddress.getByAddress would turn ::ffff:a.b.c.d into an Inet4Address.
                return Inet6Address.getByAddress(null, bytes, -1);
            }
            return InetAddress.getByAddress(bytes);
        } catch (UnknownHostException e) {
            throw new RuntimeException(
                "Illegal network address byte length of " + bytes.length, e);
        }
    }

    /**
     * IPv6 text always yields an IPv6 address, including the IPv4-mapped
     * form {@code ::ffff:a.b.c.d}.
     *
     * @param address an IPv4 or IPv6 address literal
     * @return the parsed address.
     * @throws EmptyInputException       if the address is null or empty.
     * @throws MalformedAddressException if the text is not an address literal.
     */
    public static InetAddress parse(String address) {
        return parseAddress(address).getOrThrow();
    }

    /**
     * @param address an IPv4 or IPv6 address literal
     * @return the parsed address, or empty if the text is not an address
     *         literal.
     */
    public static Optional<InetAddress> tryParse(String address) {
        return parseAddress(address).toOptional();
    }

    /**
     * @param address an IPv4 or IPv6 address
     * @return the address text, using the RFC 5952 compressed form for IPv6.
     */
    public static String toString(InetAddress address) {
        return InetAddresses.toAddrString(address);
    }

    static Result<InetAddress> parseAddress(String address) {
        if (address == null || address.isEmpty()) {
            return Result.fail(() -> new EmptyInputException("address"));
        }
        if (!InetAddresses.isInetAddress(address)) {
            return Result.fail(() -> new MalformedAddressException(address));
        }
        InetAddress ip = InetAddresses.forString(address);
        // forString collapses ::ffff:a.b.c.d to an Inet4Address; IPv6 text stays IPv6.
        if (ip instanceof Inet4Address && address.indexOf(':') >= 0) {
            return Result.of(fromBigInteger(toBigInteger(ip).or(IPV4_MAPPED_PREFIX), AddressFamily.IPV6));
        }
        return Result.of(ip);
    }
}
