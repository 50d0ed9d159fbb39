package io.queryparams.core;

import java.util.Objects;
import java.util.Optional;

/**
 * A value stored for one occurrence of a key in a parsed query string.
 *
 * <p>A token without {@code =} is stored as {@link NoValue}; a token with {@code =} is stored as
 * {@link Value}, whose text may be empty. Absence is never stored: it is the result of a lookup.
 */
public sealed interface QueryValue permits QueryValue.NoValue, QueryValue.Value {

    static QueryValue noValue() {
        return NoValue.INSTANCE;
    }

    static QueryValue of(String text) {
        return new Value(text);
    }

    /**
     * Text after the first {@code =}, if the token had one.
     */
    Optional<String> textIfPresent();

    /**
     * Key present, no {@code =}.
     */
    record NoValue() implements QueryValue {
        static final NoValue INSTANCE = new NoValue();

        @Override
        public Optional<String> textIfPresent() {
            return Optional.empty();
        }
    }

    /**
     * Key present with {@code =}; {@code text} may be empty.
     *
     * @param text the text following the first {@code =}
     */
    record Value(String text) implements QueryValue {
        public Value {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public Optional<String> textIfPresent() {
            return Optional.of(text);
        }
    }
}
