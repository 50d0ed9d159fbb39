package io.queryparams.core;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Query string codec (framework-neutral).
 *
 * <p>Grammar: {@code &}-separated tokens, each either {@code key} or {@code key=value}. Only the first
 * {@code =} of a token separates key from value.
 */
public final class QueryString {
    private QueryString() {}

    /**
     * Parses an already percent-decoded query string.
     *
     * @param query the decoded query string, without the leading {@code ?}; may be null
     * @return the parsed query, empty when {@code query} is null or empty
     */
    public static ParsedQuery parse(String query) {
        return tokenize(query, null);
    }

    /**
     * Parses a raw query string, percent-decoding each key and value after tokenizing.
     *
     * <p>Decoding happens per token so that an encoded {@code %26} or {@code %3D} never splits a token.
     *
     * @param rawQuery the raw query as found on the wire; may be null
     * @param charset the charset of percent-encoded octets
     * @throws IllegalArgumentException if a percent escape is malformed
     */
    public static ParsedQuery parseRaw(String rawQuery, Charset charset) {
        Objects.requireNonNull(charset, "charset");
        return tokenize(rawQuery, charset);
    }

    /**
     * Renders appended parameters as a query string, escaping keys and values.
     *
     * <p>A parameter without a value is rendered as a bare key.
     */
    public static String render(List<ParsedQuery.Entry> params, Charset charset) {
        Objects.requireNonNull(params, "params");
        Objects.requireNonNull(charset, "charset");
        StringBuilder sb = new StringBuilder();
        for (ParsedQuery.Entry p : params) {
            if (sb.length() > 0) sb.append('&');
            sb.append(encode(p.key(), charset));
            Optional<String> value = p.value().textIfPresent();
            if (value.isPresent()) {
                sb.append('=').append(encode(value.get(), charset));
            }
        }
        return sb.toString();
    }

    private static ParsedQuery tokenize(String query, Charset charset) {
        if (query == null || query.isEmpty()) return ParsedQuery.empty();
        List<ParsedQuery.Entry> out = new ArrayList<>();
        for (String part : query.split("&")) {
            if (part.isEmpty()) continue;
            int eq = part.indexOf('=');
            if (eq < 0) {
                out.add(new ParsedQuery.Entry(decode(part, charset), QueryValue.noValue()));
            } else {
                String k = decode(part.substring(0, eq), charset);
                String v = decode(part.substring(eq + 1), charset);
                out.add(new ParsedQuery.Entry(k, QueryValue.of(v)));
            }
        }
        return ParsedQuery.of(out);
    }

    private static String decode(String s, Charset charset) {
        return charset == null ? s : URLDecoder.decode(s, charset);
    }

    private static String encode(String s, Charset charset) {
        return URLEncoder.encode(s, charset);
    }
}
