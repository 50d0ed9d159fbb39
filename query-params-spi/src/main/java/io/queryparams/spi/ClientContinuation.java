package io.queryparams.spi;

/**
 * The remainder of a chain on the client side, waiting for the request the current combinator produced.
 *
 * @param <R> the result of encoding the remainder
 */
@FunctionalInterface
public interface ClientContinuation<R> {
    R proceed(OutgoingRequest request);
}
