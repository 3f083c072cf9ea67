package com.maxmind.net;

import java.math.BigInteger;
import java.net.Inet4Address;
import java.net.InetAddress;

/**
 * The IP version of an address or network. The family fixes the bit width
 * used by all address arithmetic.
 */
public enum AddressFamily {
    /**
     * 32-bit addresses.
     */
    IPV4(32),
    /**
     * 128-bit addresses.
     */
    IPV6(128);

    private final int bitLength;
    private final BigInteger fullMask;

    AddressFamily(int bitLength) {
        this.bitLength = bitLength;
        this.fullMask = BigInteger.ONE.shiftLeft(bitLength).subtract(BigInteger.ONE);
    }

    /**
     * @return the number of bits in an address of this family.
     */
    public int bitLength() {
        return bitLength;
    }

    /**
     * @return the number of bytes in an address of this family.
     */
    public int byteLength() {
        return bitLength / 8;
    }

    /**
     * @return the all-ones value of this family's width, e.g. 2^32 - 1.
     */
    public BigInteger fullMask() {
        return fullMask;
    }

    /**
     * @param address an IP address
     * @return the family of the address.
     */
    public static AddressFamily of(InetAddress address) {
        if (address == null) {
            throw new NullPointerException("Address cannot be null");
        }
        return address instanceof Inet4Address ? IPV4 : IPV6;
    }
}
