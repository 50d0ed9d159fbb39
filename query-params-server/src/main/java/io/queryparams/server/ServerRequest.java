package io.queryparams.server;

import io.queryparams.core.ParsedQuery;
import io.queryparams.core.QueryString;

import java.net.URI;
import java.nio.charset.Charset;
import java.util.Objects;

/**
 * Framework-neutral incoming request, reduced to what query interpretation needs.
 */
public final class ServerRequest {
    private final String method;
    private final URI uri;
    private final String decodedQuery; // set when the host already decoded the query

    private ServerRequest(String method, URI uri, String decodedQuery) {
        this.method = Objects.requireNonNull(method, "method");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.decodedQuery = decodedQuery;
    }

    /**
     * A request whose query is taken, still percent-encoded, from {@code uri}.
     */
    public static ServerRequest of(String method, URI uri) {
        return new ServerRequest(method, uri, null);
    }

    /**
     * A request whose host layer already percent-decoded the query string.
     *
     * @param decodedQuery the decoded query without the leading {@code ?}; may be null
     */
    public static ServerRequest withDecodedQuery(String method, URI uri, String decodedQuery) {
        return new ServerRequest(method, uri, decodedQuery == null ? "" : decodedQuery);
    }

    public String method() {
        return method;
    }

    public URI uri() {
        return uri;
    }

    /**
     * Parses the query string once for this request.
     *
     * @param charset charset of percent-encoded octets in the URI query; ignored for pre-decoded queries
     */
    public ParsedQuery parseQuery(Charset charset) {
        if (decodedQuery != null) return QueryString.parse(decodedQuery);
        return QueryString.parseRaw(uri.getRawQuery(), charset);
    }

    @Override
    public String toString() {
        return method + " " + uri;
    }
}
