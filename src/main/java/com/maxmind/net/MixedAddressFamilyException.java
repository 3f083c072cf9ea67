package com.maxmind.net;

/**
 * Signals that an operation requiring a single address family was given both
 * IPv4 and IPv6 inputs.
 */
public class MixedAddressFamilyException extends NetworkException {

    private static final long serialVersionUID = -2447335010952233101L;

    MixedAddressFamilyException(AddressFamily first, AddressFamily second) {
        super("Expected a single address family but got " + first + " and " + second + ".");
    }
}
