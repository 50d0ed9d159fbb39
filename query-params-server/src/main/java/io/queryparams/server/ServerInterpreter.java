package io.queryparams.server;

import io.queryparams.core.ParsedQuery;
import io.queryparams.spi.Combinator;
import io.queryparams.spi.RouteDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Interprets a {@link RouteDescriptor} against an incoming request.
 *
 * <p>The query is parsed once; each combinator decodes its own value and passes it on to the rest of the
 * chain. At the leaf the collected {@link Arguments} are bound to the handler.
 *
 * <pre>{@code
 * ServerInterpreter server = ServerInterpreter.create();
 * List<Book> books = server.handle(route, request, (req, args) -> repository.find(args.of(author)));
 * }</pre>
 */
public final class ServerInterpreter {
    private static final Logger LOGGER = LoggerFactory.getLogger(ServerInterpreter.class);

    private final Charset charset;

    public static ServerInterpreter create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private ServerInterpreter(Builder builder) {
        this.charset = builder.charset != null ? builder.charset : StandardCharsets.UTF_8;
    }

    /**
     * Decodes every argument of {@code route} from {@code request}.
     *
     * <p>Decoding never fails: absent and unparsable parameters read as their empty value.
     */
    public <R> Invocation<R> bind(RouteDescriptor route, ServerRequest request, RouteHandler<R> handler) {
        Objects.requireNonNull(route, "route");
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(handler, "handler");
        ParsedQuery query = request.parseQuery(charset);
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("Binding {} against {} query entries for {}", route.combinators(), query.size(), request);
        }
        return interpret(route, query, Arguments.empty(), request, handler);
    }

    /**
     * {@link #bind} followed by {@link Invocation#invoke()}.
     */
    public <R> R handle(RouteDescriptor route, ServerRequest request, RouteHandler<R> handler) {
        return bind(route, request, handler).invoke();
    }

    public Charset charset() {
        return charset;
    }

    private <R> Invocation<R> interpret(RouteDescriptor route,
                                        ParsedQuery query,
                                        Arguments arguments,
                                        ServerRequest request,
                                        RouteHandler<R> handler) {
        if (route instanceof RouteDescriptor.Node<?> node) {
            return step(node, query, arguments, request, handler);
        }
        return new Invocation<>(request, arguments, handler);
    }

    private <T, R> Invocation<R> step(RouteDescriptor.Node<T> node,
                                      ParsedQuery query,
                                      Arguments arguments,
                                      ServerRequest request,
                                      RouteHandler<R> handler) {
        Combinator<T> combinator = node.combinator();
        return combinator.serve(query,
                value -> interpret(node.next(), query, arguments.append(combinator, value), request, handler));
    }

    /**
     * Builder for {@link ServerInterpreter}.
     */
    public static final class Builder {
        private Charset charset;

        private Builder() {}

        /** Sets the charset of percent-encoded query octets. Default: UTF-8. */
        public Builder charset(Charset charset) {
            this.charset = charset;
            return this;
        }

        public ServerInterpreter build() {
            return new ServerInterpreter(this);
        }
    }
}
