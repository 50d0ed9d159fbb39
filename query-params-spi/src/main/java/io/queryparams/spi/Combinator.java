package io.queryparams.spi;

/**
 * One link of a route description.
 *
 * <p>A combinator kind supplies one server, one client and one documentation behavior. New kinds are added
 * by implementing this interface; interpreters and other kinds stay untouched.
 *
 * @param <T> the value decoded on the server, which is also the argument type on the client
 */
public interface Combinator<T> extends ServerInterpretable<T>, ClientInterpretable<T>, DocsInterpretable {

    /**
     * The query key this combinator owns.
     */
    String name();

    /**
     * Prepends this combinator to {@code next}.
     */
    default RouteDescriptor then(RouteDescriptor next) {
        return new RouteDescriptor.Node<>(this, next);
    }
}
