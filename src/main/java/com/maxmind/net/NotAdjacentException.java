package com.maxmind.net;

/**
 * Signals that two networks cannot be merged into a single supernet because
 * they differ in prefix length or are not contiguous.
 */
public class NotAdjacentException extends NetworkException {

    private static final long serialVersionUID = 6601938004116275713L;

    NotAdjacentException(Network first, Network second) {
        super("The networks " + first + " and " + second + " are not adjacent blocks of equal size.");
    }
}
