package com.maxmind.net;

/**
 * Signals that a prefix length is negative or longer than the address family allows.
 */
public class PrefixOutOfRangeException extends NetworkException {

    private static final long serialVersionUID = -1519460736227404467L;

    PrefixOutOfRangeException(int prefixLength, AddressFamily family) {
        super("The prefix length " + prefixLength + " is outside 0.." + family.bitLength()
            + " for " + family + ".");
    }
}
