package io.queryparams.spi;

import io.queryparams.core.ParsedQuery;

/**
 * Server-side capability of a combinator: decode its value from the incoming query.
 *
 * @param <T> the decoded value type handed to the endpoint handler
 */
public interface ServerInterpretable<T> {

    /**
     * Decodes this combinator's value from {@code query} and hands it to {@code next}.
     *
     * <p>Implementations look only at their own key(s) and must call {@code next} exactly once.
     */
    <R> R serve(ParsedQuery query, ServerContinuation<? super T, R> next);
}
