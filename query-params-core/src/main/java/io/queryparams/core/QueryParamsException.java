package io.queryparams.core;

/**
 * Base class for query-parameter related exceptions.
 *
 * <p>Decoding a parameter never raises one of these: unparsable values read as absent. They signal
 * programming errors in route composition, codecs that break their contract, and handler failures.
 */
public abstract class QueryParamsException extends RuntimeException {

    protected QueryParamsException(String message) {
        super(message);
    }

    protected QueryParamsException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when a route description or the arguments supplied for it are invalid
     * (blank parameter name, wrong argument count, argument of the wrong type).
     */
    public static class RouteComposition extends QueryParamsException {
        public RouteComposition(String message) {
            super(message);
        }
    }

    /**
     * Raised when a {@link TextCodec} fails to encode a value, breaking its totality contract.
     */
    public static class TextEncoding extends QueryParamsException {
        public TextEncoding(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when a registry has no codec for a requested type.
     */
    public static class MissingCodec extends QueryParamsException {
        public MissingCodec(String message) {
            super(message);
        }
    }

    /**
     * Wraps a checked exception thrown by an endpoint handler.
     */
    public static class HandlerInvocation extends QueryParamsException {
        public HandlerInvocation(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
