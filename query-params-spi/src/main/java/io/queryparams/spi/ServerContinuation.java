package io.queryparams.spi;

/**
 * The remainder of a chain on the server side, waiting for the value decoded by the current combinator.
 *
 * @param <T> the decoded value type
 * @param <R> the result of handling the remainder
 */
@FunctionalInterface
public interface ServerContinuation<T, R> {
    R proceed(T value);
}
