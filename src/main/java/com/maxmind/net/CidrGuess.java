package com.maxmind.net;

import java.util.OptionalInt;

/**
 * CidrGuess is a strategy for deriving a prefix length from an address that
 * was given without one, e.g. {@code "10.1.2.3"}. It is consulted by
 * {@link NetworkParser} for single-token input.
 */
public interface CidrGuess {
    /**
     * @param address an address literal without a prefix length
     * @return the guessed prefix length, or empty if none can be guessed.
     *         Implementations must not throw for malformed input.
     */
    OptionalInt tryGuess(String address);
}
