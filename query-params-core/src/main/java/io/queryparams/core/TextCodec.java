package io.queryparams.core;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Conversion between a value type and its query-string text.
 *
 * <p>{@link #decode(String)} fails silently by returning {@link Optional#empty()} and must not throw.
 * {@link #encode(Object)} is total: every value of the type has a text form.
 *
 * @param <T> the value type
 */
public interface TextCodec<T> {

    /**
     * The Java type this codec converts.
     */
    Class<T> valueType();

    Optional<T> decode(String text);

    String encode(T value);

    /**
     * Builds a codec from a decoding and an encoding function.
     *
     * @param valueType the converted type
     * @param decoder must not throw; returns empty for unparsable text
     * @param encoder total encoder
     */
    static <T> TextCodec<T> of(Class<T> valueType, Function<String, Optional<T>> decoder, Function<? super T, String> encoder) {
        Objects.requireNonNull(valueType, "valueType");
        Objects.requireNonNull(decoder, "decoder");
        Objects.requireNonNull(encoder, "encoder");
        return new TextCodec<>() {
            @Override
            public Class<T> valueType() {
                return valueType;
            }

            @Override
            public Optional<T> decode(String text) {
                return decoder.apply(text);
            }

            @Override
            public String encode(T value) {
                return encoder.apply(value);
            }

            @Override
            public String toString() {
                return "TextCodec[" + valueType.getSimpleName() + "]";
            }
        };
    }
}
