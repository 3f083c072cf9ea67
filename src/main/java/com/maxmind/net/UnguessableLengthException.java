package com.maxmind.net;

/**
 * Signals that a bare address was given and the {@link CidrGuess} strategy could
 * not derive a prefix length for it.
 */
public class UnguessableLengthException extends NetworkException {

    private static final long serialVersionUID = 8890126755932470325L;

    UnguessableLengthException(String address) {
        super("Unable to guess a prefix length for \"" + address + "\".");
    }
}
