package io.queryparams.server;

import io.queryparams.spi.Combinator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Values decoded by the combinators of a route, in chain order.
 *
 * <p>Handlers read them positionally or, typed, by the combinator that produced them:
 * <pre>{@code
 * QueryParam<String> author = Combinators.param("author", TextCodecs.string());
 * ...
 * Optional<String> value = arguments.of(author);
 * }</pre>
 */
public final class Arguments {

    private static final Arguments EMPTY = new Arguments(List.of(), List.of());

    private final List<Combinator<?>> sources;
    private final List<Object> values;

    private Arguments(List<Combinator<?>> sources, List<Object> values) {
        this.sources = sources;
        this.values = values;
    }

    public static Arguments empty() {
        return EMPTY;
    }

    /**
     * Copy with {@code value}, decoded by {@code source}, appended.
     */
    public <T> Arguments append(Combinator<T> source, T value) {
        Objects.requireNonNull(source, "source");
        List<Combinator<?>> nextSources = new ArrayList<>(sources);
        nextSources.add(source);
        List<Object> nextValues = new ArrayList<>(values);
        nextValues.add(value);
        return new Arguments(List.copyOf(nextSources), Collections.unmodifiableList(nextValues));
    }

    public int size() {
        return values.size();
    }

    public Object get(int index) {
        return values.get(index);
    }

    /**
     * Positional access with a type check.
     *
     * @throws ClassCastException if the value at {@code index} is not a {@code type}
     */
    public <T> T get(int index, Class<T> type) {
        return type.cast(values.get(index));
    }

    /**
     * The value decoded by {@code combinator}; when it occurs more than once in the chain, its first
     * occurrence is used.
     *
     * @throws IllegalArgumentException if {@code combinator} is not part of the interpreted chain
     */
    @SuppressWarnings("unchecked")
    public <T> T of(Combinator<T> combinator) {
        Objects.requireNonNull(combinator, "combinator");
        for (int i = 0; i < sources.size(); i++) {
            if (sources.get(i) == combinator) return (T) values.get(i);
        }
        throw new IllegalArgumentException("combinator " + combinator + " is not part of this route");
    }

    public List<Object> asList() {
        return values;
    }

    @Override
    public String toString() {
        return "Arguments" + values;
    }
}
