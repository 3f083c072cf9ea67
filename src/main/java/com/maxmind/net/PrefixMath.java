package com.maxmind.net;

import java.math.BigInteger;
import java.net.InetAddress;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Pure functions over prefix lengths, netmasks and address integers. All
 * arithmetic is unsigned and bounded by the width of the address family.
 */
public final class PrefixMath {

    private static final Pattern PREFIX_LENGTH = Pattern.compile("\\d{1,3}");

    private static final BigInteger TWO = BigInteger.valueOf(2);

    private PrefixMath() {
    }

    /**
     * @param prefixLength the number of leading one bits
     * @param family       the address family
     * @return the netmask as an integer, e.g. {@code 0xFFFFFF00} for an IPv4
     *         /24.
     * @throws PrefixOutOfRangeException if the prefix length does not fit the
     *                                   family.
     */
    public static BigInteger netmask(int prefixLength, AddressFamily family) {
        return computeNetmask(prefixLength, family).getOrThrow();
    }

    /**
     * @param prefixLength the number of leading one bits
     * @param family       the address family
     * @return the netmask as an integer, or empty if the prefix length does
     *         not fit the family.
     */
    public static Optional<BigInteger> tryNetmask(int prefixLength, AddressFamily family) {
        return computeNetmask(prefixLength, family).toOptional();
    }

    /**
     * @param prefixLength the number of leading one bits
     * @param family       the address family
     * @return the netmask as an address, e.g. {@code 255.255.255.0}.
     * @throws PrefixOutOfRangeException if the prefix length does not fit the
     *                                   family.
     */
    public static InetAddress netmaskAddress(int prefixLength, AddressFamily family) {
        return computeNetmask(prefixLength, family)
            .map(mask -> AddressCodec.fromBigInteger(mask, family))
            .getOrThrow();
    }

    /**
     * @param prefixLength the number of leading one bits
     * @param family       the address family
     * @return the netmask as an address, or empty if the prefix length does
     *         not fit the family.
     */
    public static Optional<InetAddress> tryNetmaskAddress(int prefixLength, AddressFamily family) {
        return computeNetmask(prefixLength, family)
            .map(mask -> AddressCodec.fromBigInteger(mask, family))
            .toOptional();
    }

    /**
     * @param netmask a netmask integer
     * @param family  the address family
     * @return the prefix length of the netmask.
     * @throws InvalidNetmaskException if the value is not a contiguous run of
     *                                 leading one bits.
     */
    public static int cidrFromNetmask(BigInteger netmask, AddressFamily family) {
        return computeCidr(netmask, family).getOrThrow();
    }

    /**
     * @param netmask a netmask integer
     * @param family  the address family
     * @return the prefix length of the netmask, or empty if it is not a valid
     *         netmask.
     */
    public static OptionalInt tryCidrFromNetmask(BigInteger netmask, AddressFamily family) {
        Result<Integer> cidr = computeCidr(netmask, family);
        return cidr.isPresent() ? OptionalInt.of(cidr.getOrThrow()) : OptionalInt.empty();
    }

    /**
     * @param netmask a netmask address such as {@code 255.255.240.0}
     * @return the prefix length of the netmask.
     * @throws InvalidNetmaskException if the address is not a valid netmask.
     */
    public static int cidrFromNetmask(InetAddress netmask) {
        return cidrFromNetmask(AddressCodec.toBigInteger(netmask), AddressFamily.of(netmask));
    }

    /**
     * @param netmask a netmask address such as {@code 255.255.240.0}
     * @return the prefix length of the netmask, or empty if the address is
     *         not a valid netmask.
     */
    public static OptionalInt tryCidrFromNetmask(InetAddress netmask) {
        return tryCidrFromNetmask(AddressCodec.toBigInteger(netmask), AddressFamily.of(netmask));
    }

    /**
     * A value is a netmask when its complement within the family width plus
     * one shares no bits with that complement, i.e. the complement is
     * {@code 2^n - 1}.
     *
     * @param netmask a candidate netmask integer
     * @param family  the address family
     * @return whether the value is a contiguous run of leading one bits.
     */
    public static boolean isValidNetmask(BigInteger netmask, AddressFamily family) {
        if (family == null) {
            throw new NullPointerException("Address family cannot be null");
        }
        if (netmask.signum() < 0 || netmask.bitLength() > family.bitLength()) {
            return false;
        }
        BigInteger inverted = netmask.not().and(family.fullMask());
        return inverted.add(BigInteger.ONE).and(inverted).signum() == 0;
    }

    /**
     * @param netmask a candidate netmask address
     * @return whether the address is a contiguous run of leading one bits.
     */
    public static boolean isValidNetmask(InetAddress netmask) {
        return isValidNetmask(AddressCodec.toBigInteger(netmask), AddressFamily.of(netmask));
    }

    /**
     * @param network the network integer
     * @param netmask the netmask integer
     * @param family  the address family
     * @return the highest address of the network, the network with all host
     *         bits set.
     */
    public static BigInteger broadcast(BigInteger network, BigInteger netmask, AddressFamily family) {
        return network.add(family.fullMask().andNot(netmask));
    }

    /**
     * @param value a non-negative integer
     * @return the number of one bits in the value.
     */
    public static int bitsSet(BigInteger value) {
        return value.bitCount();
    }

    /**
     * @param address an address, typically a netmask
     * @return the number of one bits in the address.
     */
    public static int bitsSet(InetAddress address) {
        return bitsSet(AddressCodec.toBigInteger(address));
    }

    /**
     * @param prefixLength the prefix length
     * @param family       the address family
     * @return the number of addresses in a network of this size.
     */
    public static BigInteger totalCount(int prefixLength, AddressFamily family) {
        checkPrefixLength(prefixLength, family);
        return TWO.pow(family.bitLength() - prefixLength);
    }

    /**
     * IPv4 networks reserve their network and broadcast addresses, so a /31 or
     * /32 has no usable address. IPv6 has no such reservation.
     *
     * @param prefixLength the prefix length
     * @param family       the address family
     * @return the number of usable host addresses in a network of this size.
     */
    public static BigInteger usableCount(int prefixLength, AddressFamily family) {
        BigInteger total = totalCount(prefixLength, family);
        if (family == AddressFamily.IPV6) {
            return total;
        }
        if (prefixLength > 30) {
            return BigInteger.ZERO;
        }
        return total.subtract(TWO);
    }

    /**
     * @param prefixLength the prefix length
     * @param family       the address family
     * @return the wildcard mask integer, the host bits of the netmask set.
     */
    public static BigInteger wildcardMask(int prefixLength, AddressFamily family) {
        return family.fullMask().subtract(netmask(prefixLength, family));
    }

    /**
     * @param text   a decimal prefix length such as {@code "24"}
     * @param family the address family the prefix length applies to
     * @return the prefix length, or empty if the text is not a decimal number
     *         within the family's range.
     */
    public static OptionalInt tryParsePrefixLength(String text, AddressFamily family) {
        if (text == null || !PREFIX_LENGTH.matcher(text).matches()) {
            return OptionalInt.empty();
        }
        int prefixLength = Integer.parseInt(text);
        if (prefixLength > family.bitLength()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(prefixLength);
    }

    static boolean isPrefixLengthInRange(int prefixLength, AddressFamily family) {
        return prefixLength >= 0 && prefixLength <= family.bitLength();
    }

    static Result<BigInteger> computeNetmask(int prefixLength, AddressFamily family) {
        if (family == null) {
            throw new NullPointerException("Address family cannot be null");
        }
        if (!isPrefixLengthInRange(prefixLength, family)) {
            return Result.fail(() -> new PrefixOutOfRangeException(prefixLength, family));
        }
        if (prefixLength == 0) {
            return Result.of(BigInteger.ZERO);
        }
        BigInteger full = family.fullMask();
        return Result.of(full.shiftLeft(family.bitLength() - prefixLength).and(full));
    }

    static Result<Integer> computeCidr(BigInteger netmask, AddressFamily family) {
        if (!isValidNetmask(netmask, family)) {
            return Result.fail(() -> new InvalidNetmaskException(
                AddressCodec.toString(AddressCodec.fromBigInteger(netmask.abs(), family))));
        }
        return Result.of(bitsSet(netmask));
    }

    private static void checkPrefixLength(int prefixLength, AddressFamily family) {
        if (!isPrefixLengthInRange(prefixLength, family)) {
            throw new PrefixOutOfRangeException(prefixLength, family);
        }
    }
}
