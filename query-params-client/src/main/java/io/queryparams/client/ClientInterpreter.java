package io.queryparams.client;

import io.queryparams.core.QueryParamsException;
import io.queryparams.spi.Combinator;
import io.queryparams.spi.OutgoingRequest;
import io.queryparams.spi.RouteDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Interprets a {@link RouteDescriptor} on the calling side, turning call arguments into an outgoing request.
 *
 * <p>Arguments are matched to combinators in chain order. They are checked against the whole chain before
 * anything is encoded, so a bad call never yields a half-built request.
 *
 * <pre>{@code
 * OutgoingRequest request = ClientInterpreter.create().request(
 *     route, OutgoingRequest.to(URI.create("http://localhost/books")),
 *     Optional.of("Asimov"), List.of(1950, 1951), true);
 * }</pre>
 */
public final class ClientInterpreter {
    private static final Logger LOGGER = LoggerFactory.getLogger(ClientInterpreter.class);

    private final Charset charset;

    public static ClientInterpreter create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private ClientInterpreter(Builder builder) {
        this.charset = builder.charset != null ? builder.charset : StandardCharsets.UTF_8;
    }

    /**
     * Encodes {@code arguments} into {@code base}. The returned request escapes with this interpreter's
     * charset.
     *
     * @throws QueryParamsException.RouteComposition if the argument count differs from the route's arity or an
     *         argument has the wrong type
     */
    public OutgoingRequest request(RouteDescriptor route, OutgoingRequest base, Object... arguments) {
        Objects.requireNonNull(route, "route");
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(arguments, "arguments");
        List<Object> args = Arrays.asList(arguments);
        validate(route, args);
        LOGGER.trace("Encoding {} arguments into {}", args.size(), base.base());
        return interpret(route, base.withCharset(charset), args, 0);
    }

    /**
     * Encodes {@code arguments} and renders the resulting URI with this interpreter's charset.
     */
    public URI uri(RouteDescriptor route, URI base, Object... arguments) {
        return request(route, OutgoingRequest.to(base, charset), arguments).toUri();
    }

    /**
     * Binds {@code route} to {@code base} for repeated calls.
     */
    public RouteClient bind(RouteDescriptor route, URI base) {
        return new RouteClient(this, route, base);
    }

    public Charset charset() {
        return charset;
    }

    private static void validate(RouteDescriptor route, List<Object> args) {
        List<Combinator<?>> combinators = route.combinators();
        if (combinators.size() != args.size()) {
            throw new QueryParamsException.RouteComposition(
                    "route takes " + combinators.size() + " arguments, got " + args.size());
        }
        for (int i = 0; i < combinators.size(); i++) {
            combinators.get(i).coerceArgument(args.get(i));
        }
    }

    private OutgoingRequest interpret(RouteDescriptor route, OutgoingRequest request, List<Object> args, int index) {
        if (route instanceof RouteDescriptor.Node<?> node) {
            return step(node, request, args, index);
        }
        return request;
    }

    private <T> OutgoingRequest step(RouteDescriptor.Node<T> node, OutgoingRequest request, List<Object> args, int index) {
        Combinator<T> combinator = node.combinator();
        T argument = combinator.coerceArgument(args.get(index));
        return combinator.encode(request, argument, next -> interpret(node.next(), next, args, index + 1));
    }

    /**
     * Builder for {@link ClientInterpreter}.
     */
    public static final class Builder {
        private Charset charset;

        private Builder() {}

        /** Sets the charset used to escape rendered URIs. Default: UTF-8. */
        public Builder charset(Charset charset) {
            this.charset = charset;
            return this;
        }

        public ClientInterpreter build() {
            return new ClientInterpreter(this);
        }
    }
}
