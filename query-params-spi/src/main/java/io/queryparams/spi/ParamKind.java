package io.queryparams.spi;

import java.util.Objects;

/**
 * How a documented query parameter behaves.
 *
 * <p>Open-ended: the built-in combinators use the constants below, new combinator kinds may define their own.
 *
 * @param label short identifier of the kind
 */
public record ParamKind(String label) {

    /** At most one value, decoded into an optional. */
    public static final ParamKind SINGLE_OPTIONAL = new ParamKind("single-optional");

    /** Zero or more occurrences, also accepted under the {@code name[]} key. */
    public static final ParamKind MULTI = new ParamKind("multi");

    /** Boolean inferred from the presence of a key. */
    public static final ParamKind FLAG = new ParamKind("flag");

    public ParamKind {
        Objects.requireNonNull(label, "label");
        if (label.isBlank()) {
            throw new IllegalArgumentException("label must not be blank");
        }
    }

    @Override
    public String toString() {
        return label;
    }
}
