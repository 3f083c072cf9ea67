package com.maxmind.net;

/**
 * Signals that a network cannot be split at the requested prefix length.
 */
public class InvalidSplitException extends NetworkException {

    private static final long serialVersionUID = 7340921457735160012L;

    InvalidSplitException(Network network, int prefixLength) {
        super("Cannot split " + network + " into /" + prefixLength + " subnets; the prefix length must be within "
            + network.prefixLength() + ".." + network.family().bitLength() + ".");
    }
}
