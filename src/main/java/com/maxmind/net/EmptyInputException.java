package com.maxmind.net;

/**
 * Signals that a required input string or collection was null or empty.
 */
public class EmptyInputException extends NetworkException {

    private static final long serialVersionUID = 1877651327012316551L;

    EmptyInputException(String what) {
        super("The " + what + " cannot be null or empty.");
    }
}
