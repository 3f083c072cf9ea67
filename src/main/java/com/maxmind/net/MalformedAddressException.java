package com.maxmind.net;

/**
 * Signals that a string is not an IPv4 or IPv6 address literal.
 */
public class MalformedAddressException extends NetworkException {

    private static final long serialVersionUID = -6337914409751190225L;

    MalformedAddressException(String address) {
        super("Unable to parse \"" + address + "\" as an IP address.");
    }

    MalformedAddressException(String address, String detail) {
        super("Unable to parse \"" + address + "\" as an IP network: " + detail);
    }
}
