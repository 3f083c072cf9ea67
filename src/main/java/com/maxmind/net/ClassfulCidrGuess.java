package com.maxmind.net;

import java.net.InetAddress;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Guesses the prefix length of an IPv4 address from its legacy address class:
 * class A ({@code 0.x} to {@code 127.x}) is a /8, class B ({@code 128.x} to
 * {@code 191.x}) a /16 and class C ({@code 192.x} to {@code 223.x}) a /24.
 * Class D and E addresses and IPv6 addresses have no class, so no guess is
 * made for them.
 */
public final class ClassfulCidrGuess implements CidrGuess {

    private static final ClassfulCidrGuess INSTANCE = new ClassfulCidrGuess();

    private ClassfulCidrGuess() {
    }

    @Override
    public OptionalInt tryGuess(String address) {
        Optional<InetAddress> parsed = AddressCodec.tryParse(address);
        if (parsed.isEmpty() || AddressFamily.of(parsed.get()) != AddressFamily.IPV4) {
            return OptionalInt.empty();
        }
        int firstOctet = parsed.get().getAddress()[0] & 0xFF;
        if (firstOctet < 128) {
            return OptionalInt.of(8);
        }
        if (firstOctet < 192) {
            return OptionalInt.of(16);
        }
        if (firstOctet < 224) {
            return OptionalInt.of(24);
        }
        return OptionalInt.empty();
    }

    /**
     * @return the singleton instance of the ClassfulCidrGuess class
     */
    public static ClassfulCidrGuess getInstance() {
        return INSTANCE;
    }
}
