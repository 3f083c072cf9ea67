package com.maxmind.net;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/*
 * Outcome of a fallible computation. Internal code always computes a Result;
 * the public try* methods expose it as an Optional and the throwing methods
 * call getOrThrow(). The failure is only materialized on the throwing path.
 */
final class Result<T> {
    private final T value;
    private final Supplier<? extends NetworkException> failure;

    private Result(T value, Supplier<? extends NetworkException> failure) {
        this.value = value;
        this.failure = failure;
    }

    static <T> Result<T> of(T value) {
        if (value == null) {
            throw new NullPointerException("Result value cannot be null");
        }
        return new Result<>(value, null);
    }

    static <T> Result<T> fail(Supplier<? extends NetworkException> failure) {
        return new Result<>(null, failure);
    }

    boolean isPresent() {
        return failure == null;
    }

    <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        if (failure != null) {
            return fail(failure);
        }
        return of(mapper.apply(value));
    }

    <R> Result<R> flatMap(Function<? super T, Result<R>> mapper) {
        if (failure != null) {
            return fail(failure);
        }
        return mapper.apply(value);
    }

    Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    T getOrThrow() {
        if (failure != null) {
            throw failure.get();
        }
        return value;
    }
}
