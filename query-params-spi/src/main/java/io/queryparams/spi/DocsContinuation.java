package io.queryparams.spi;

/**
 * The remainder of a chain in documentation, waiting for the docs the current combinator registered.
 *
 * @param <R> the result of documenting the remainder
 */
@FunctionalInterface
public interface DocsContinuation<R> {
    R proceed(ActionDocs docs);
}
