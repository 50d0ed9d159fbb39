package io.queryparams.spi;

import io.queryparams.core.ParsedQuery;
import io.queryparams.core.QueryString;
import io.queryparams.core.QueryValue;

import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outgoing request under construction by the client interpreter.
 *
 * <p>Immutable: {@link #append(String, Optional)} returns an updated copy, so a request can be threaded
 * through a chain of combinators without shared state.
 */
public final class OutgoingRequest {

    private final URI base;
    private final Charset charset;
    private final List<ParsedQuery.Entry> params;

    private OutgoingRequest(URI base, Charset charset, List<ParsedQuery.Entry> params) {
        this.base = base;
        this.charset = charset;
        this.params = params;
    }

    /**
     * A request to {@code base} with no appended parameters, escaped as UTF-8. Any query already present on
     * {@code base} is kept in front of the appended ones.
     */
    public static OutgoingRequest to(URI base) {
        return to(base, StandardCharsets.UTF_8);
    }

    /**
     * A request to {@code base} whose parameters are escaped with {@code charset} by {@link #toUri()} and
     * {@link #queryString()}.
     */
    public static OutgoingRequest to(URI base, Charset charset) {
        return new OutgoingRequest(Objects.requireNonNull(base, "base"),
                Objects.requireNonNull(charset, "charset"), List.of());
    }

    public URI base() {
        return base;
    }

    public Charset charset() {
        return charset;
    }

    /** Copy escaped with {@code charset}; the appended parameters are kept. */
    public OutgoingRequest withCharset(Charset charset) {
        Objects.requireNonNull(charset, "charset");
        if (charset.equals(this.charset)) return this;
        return new OutgoingRequest(base, charset, params);
    }

    /**
     * Appended parameters in order; a bare key is stored as {@link QueryValue.NoValue}.
     */
    public List<ParsedQuery.Entry> params() {
        return params;
    }

    /**
     * Appends {@code name}, as a bare key when {@code value} is empty.
     */
    public OutgoingRequest append(String name, Optional<String> value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        QueryValue stored = value.isPresent() ? QueryValue.of(value.get()) : QueryValue.noValue();
        List<ParsedQuery.Entry> next = new ArrayList<>(params.size() + 1);
        next.addAll(params);
        next.add(new ParsedQuery.Entry(name, stored));
        return new OutgoingRequest(base, charset, List.copyOf(next));
    }

    /**
     * The appended parameters rendered with this request's charset.
     */
    public String queryString() {
        return queryString(charset);
    }

    public String queryString(Charset charset) {
        return QueryString.render(params, charset);
    }

    public URI toUri() {
        return toUri(charset);
    }

    /**
     * The base URI with the appended parameters added to its query.
     */
    public URI toUri(Charset charset) {
        if (params.isEmpty()) return base;
        String appended = queryString(charset);
        String s = base.toString();
        int hash = s.indexOf('#');
        String fragment = hash >= 0 ? s.substring(hash) : "";
        String head = hash >= 0 ? s.substring(0, hash) : s;
        StringBuilder sb = new StringBuilder(head);
        if (base.getRawQuery() == null) {
            sb.append('?');
        } else if (!base.getRawQuery().isEmpty()) {
            sb.append('&');
        }
        sb.append(appended).append(fragment);
        return URI.create(sb.toString());
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof OutgoingRequest)) return false;
        OutgoingRequest that = (OutgoingRequest) other;
        return base.equals(that.base) && charset.equals(that.charset) && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, charset, params);
    }

    @Override
    public String toString() {
        return "OutgoingRequest{" + toUri() + "}";
    }
}
