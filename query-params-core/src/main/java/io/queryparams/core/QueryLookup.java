package io.queryparams.core;

import java.util.Objects;

/**
 * Tri-state result of looking up a single key in a {@link ParsedQuery}.
 */
public sealed interface QueryLookup permits QueryLookup.Absent, QueryLookup.PresentNoValue, QueryLookup.PresentWithValue {

    static QueryLookup absent() {
        return Absent.INSTANCE;
    }

    static QueryLookup of(QueryValue value) {
        Objects.requireNonNull(value, "value");
        if (value instanceof QueryValue.Value v) return new PresentWithValue(v.text());
        return PresentNoValue.INSTANCE;
    }

    /** The key does not occur in the query string. */
    record Absent() implements QueryLookup {
        static final Absent INSTANCE = new Absent();
    }

    /** The key occurs without {@code =}. */
    record PresentNoValue() implements QueryLookup {
        static final PresentNoValue INSTANCE = new PresentNoValue();
    }

    /**
     * The key occurs with {@code =}.
     *
     * @param text text after the first {@code =}, possibly empty
     */
    record PresentWithValue(String text) implements QueryLookup {
        public PresentWithValue {
            Objects.requireNonNull(text, "text");
        }
    }
}
