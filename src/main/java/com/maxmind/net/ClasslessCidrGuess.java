package com.maxmind.net;

import java.util.OptionalInt;

/**
 * Treats a bare address as a single host: /32 for IPv4 and /128 for IPv6.
 */
public final class ClasslessCidrGuess implements CidrGuess {

    private static final ClasslessCidrGuess INSTANCE = new ClasslessCidrGuess();

    private ClasslessCidrGuess() {
    }

    @Override
    public OptionalInt tryGuess(String address) {
        return AddressCodec.tryParse(address)
            .map(ip -> OptionalInt.of(AddressFamily.of(ip).bitLength()))
            .orElse(OptionalInt.empty());
    }

    /**
     * @return the singleton instance of the ClasslessCidrGuess class
     */
    public static ClasslessCidrGuess getInstance() {
        return INSTANCE;
    }
}
