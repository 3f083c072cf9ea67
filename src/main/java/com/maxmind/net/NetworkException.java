package com.maxmind.net;

/**
 * This class represents a generic error raised while parsing or combining
 * networks. All other exceptions thrown by this library subclass it.
 *
 * <p>It extends {@link RuntimeException} because every fallible operation
 * also has a {@code try} form that returns an empty {@link java.util.Optional}
 * instead of throwing.</p>
 */
public class NetworkException extends RuntimeException {

    private static final long serialVersionUID = 4102392842185315376L;

    /**
     * @param message A message describing the reason why the exception was
     *                thrown.
     */
    NetworkException(String message) {
        super(message);
    }
}
