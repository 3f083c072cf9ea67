package com.maxmind.net;

/**
 * Signals that a netmask is not a contiguous run of leading one bits.
 */
public class InvalidNetmaskException extends NetworkException {

    private static final long serialVersionUID = 3329184013486551140L;

    InvalidNetmaskException(String netmask) {
        super("The netmask " + netmask + " is not a contiguous run of leading one bits.");
    }
}
