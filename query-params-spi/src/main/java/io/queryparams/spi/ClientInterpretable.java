package io.queryparams.spi;

/**
 * Client-side capability of a combinator: encode a call argument into the outgoing request.
 *
 * @param <T> the argument type
 */
public interface ClientInterpretable<T> {

    /**
     * Appends whatever {@code argument} contributes to {@code request} and hands the result to {@code next}.
     */
    <R> R encode(OutgoingRequest request, T argument, ClientContinuation<R> next);

    /**
     * Checks that a dynamically typed client argument fits this combinator.
     *
     * @return the argument, typed
     * @throws io.queryparams.core.QueryParamsException.RouteComposition if it does not fit
     */
    T coerceArgument(Object argument);
}
