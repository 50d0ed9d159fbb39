package io.queryparams.server;

import io.queryparams.core.QueryParamsException;

import java.util.Objects;

/**
 * A handler with every route argument decoded, ready to run.
 *
 * @param <R> the handler's result
 */
public final class Invocation<R> {
    private final ServerRequest request;
    private final Arguments arguments;
    private final RouteHandler<R> handler;

    Invocation(ServerRequest request, Arguments arguments, RouteHandler<R> handler) {
        this.request = Objects.requireNonNull(request, "request");
        this.arguments = Objects.requireNonNull(arguments, "arguments");
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    public ServerRequest request() {
        return request;
    }

    public Arguments arguments() {
        return arguments;
    }

    /**
     * Runs the handler.
     *
     * <p>Unchecked exceptions propagate as thrown; checked ones are wrapped. An interrupted handler leaves the
     * calling thread's interrupt flag set.
     *
     * @throws QueryParamsException.HandlerInvocation if the handler throws a checked exception
     */
    public R invoke() {
        try {
            return handler.handle(request, arguments);
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryParamsException.HandlerInvocation("handler interrupted for " + request, e);
        } catch (Exception e) {
            throw new QueryParamsException.HandlerInvocation("handler failed for " + request, e);
        }
    }
}
