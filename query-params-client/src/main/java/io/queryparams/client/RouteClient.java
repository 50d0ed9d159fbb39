package io.queryparams.client;

import io.queryparams.spi.OutgoingRequest;
import io.queryparams.spi.RouteDescriptor;

import java.net.URI;
import java.util.Objects;

/**
 * A route bound to the URI it is called at.
 */
public final class RouteClient {
    private final ClientInterpreter interpreter;
    private final RouteDescriptor route;
    private final URI base;

    RouteClient(ClientInterpreter interpreter, RouteDescriptor route, URI base) {
        this.interpreter = Objects.requireNonNull(interpreter, "interpreter");
        this.route = Objects.requireNonNull(route, "route");
        this.base = Objects.requireNonNull(base, "base");
    }

    public RouteDescriptor route() {
        return route;
    }

    public URI base() {
        return base;
    }

    public OutgoingRequest request(Object... arguments) {
        return interpreter.request(route, OutgoingRequest.to(base, interpreter.charset()), arguments);
    }

    public URI uri(Object... arguments) {
        return interpreter.uri(route, base, arguments);
    }
}
