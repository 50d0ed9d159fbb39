package io.queryparams.server;

/**
 * The endpoint action at the leaf of a route.
 *
 * @param <R> the handler's result
 */
@FunctionalInterface
public interface RouteHandler<R> {
    R handle(ServerRequest request, Arguments arguments) throws Exception;
}
