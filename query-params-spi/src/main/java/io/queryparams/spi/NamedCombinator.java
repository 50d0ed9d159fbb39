package io.queryparams.spi;

import io.queryparams.core.QueryParamsException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Common state of the built-in combinators: the owned key and its documentation metadata.
 */
abstract class NamedCombinator<T> implements Combinator<T> {

    private final String name;
    private final Optional<String> description;
    private final List<String> values;

    NamedCombinator(String name, Optional<String> description, List<String> values) {
        this.name = validateName(name);
        this.description = Objects.requireNonNull(description, "description");
        this.values = List.copyOf(values);
    }

    @Override
    public final String name() {
        return name;
    }

    public final Optional<String> description() {
        return description;
    }

    public final List<String> values() {
        return values;
    }

    final DocEntry docEntry(ParamKind kind) {
        return new DocEntry(name, kind, description, values);
    }

    final QueryParamsException.RouteComposition badArgument(String expected, Object actual) {
        String got = actual == null ? "null" : actual.getClass().getName();
        return new QueryParamsException.RouteComposition(
                "query parameter '" + name + "' expects " + expected + ", got " + got);
    }

    private static String validateName(String name) {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new QueryParamsException.RouteComposition("query parameter name must not be blank");
        }
        if (name.indexOf('&') >= 0 || name.indexOf('=') >= 0) {
            throw new QueryParamsException.RouteComposition("query parameter name contains forbidden characters: & =");
        }
        return name;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
