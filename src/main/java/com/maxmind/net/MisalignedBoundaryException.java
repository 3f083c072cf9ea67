package com.maxmind.net;

/**
 * Signals that two adjacent networks of equal size do not start on the boundary
 * of the supernet that would cover them, e.g. {@code 10.0.1.0/24} and
 * {@code 10.0.2.0/24}.
 */
public class MisalignedBoundaryException extends NetworkException {

    private static final long serialVersionUID = 1250683962342918447L;

    MisalignedBoundaryException(Network first, Network second) {
        super("The networks " + first + " and " + second
            + " are adjacent but do not share a CIDR boundary.");
    }
}
