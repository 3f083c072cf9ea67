package com.maxmind.net;

/**
 * Signals that the netmask part of a network string is not an address literal.
 */
public class MalformedNetmaskException extends NetworkException {

    private static final long serialVersionUID = 5207466032590163817L;

    MalformedNetmaskException(String netmask) {
        super("Unable to parse \"" + netmask + "\" as a netmask.");
    }
}
