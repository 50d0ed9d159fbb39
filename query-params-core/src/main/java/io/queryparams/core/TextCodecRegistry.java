package io.queryparams.core;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registry that resolves a {@link TextCodec} for a value type.
 *
 * <p>Use {@link #builder()} to create a registry with explicit codec registration:
 * <pre>{@code
 * TextCodecRegistry registry = TextCodecRegistry.builder()
 *     .registerAll(TextCodecs.builtIns())
 *     .register(TextCodecs.enumOf(Genre.class))
 *     .build();
 * }</pre>
 *
 * <p>See {@link ServiceLoaderTextCodecRegistry} for discovery through {@link java.util.ServiceLoader}.
 */
@FunctionalInterface
public interface TextCodecRegistry {

    /**
     * Raw lookup by type.
     *
     * @param type the value type
     * @return the codec if one is registered for exactly that type
     */
    Optional<TextCodec<?>> lookup(Class<?> type);

    /**
     * Typed lookup.
     */
    @SuppressWarnings("unchecked")
    default <T> Optional<TextCodec<T>> find(Class<T> type) {
        Objects.requireNonNull(type, "type");
        return lookup(type).map(c -> (TextCodec<T>) c);
    }

    /**
     * Typed lookup that fails when no codec is registered.
     *
     * @throws QueryParamsException.MissingCodec if the type has no codec
     */
    default <T> TextCodec<T> require(Class<T> type) {
        return find(type).orElseThrow(() -> new QueryParamsException.MissingCodec(
                "no TextCodec registered for " + type.getName()));
    }

    /**
     * Registry containing only {@link TextCodecs#builtIns()}.
     */
    static TextCodecRegistry builtIns() {
        return builder().registerAll(TextCodecs.builtIns()).build();
    }

    static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for creating a {@link TextCodecRegistry} with explicit codec registration.
     */
    final class Builder {
        private final Map<Class<?>, TextCodec<?>> codecs = new HashMap<>();

        private Builder() {}

        /**
         * Register a codec. A later registration for the same {@link TextCodec#valueType()} replaces
         * the earlier one.
         *
         * @param codec the codec to register
         * @return this builder
         */
        public Builder register(TextCodec<?> codec) {
            Objects.requireNonNull(codec, "codec");
            Class<?> type = codec.valueType();
            if (type == null) {
                throw new IllegalArgumentException("codec valueType must not be null");
            }
            codecs.put(type, codec);
            return this;
        }

        /**
         * Register multiple codecs.
         *
         * @param codecs the codecs to register
         * @return this builder
         */
        public Builder registerAll(Iterable<? extends TextCodec<?>> codecs) {
            for (TextCodec<?> codec : codecs) {
                register(codec);
            }
            return this;
        }

        /**
         * Build the registry.
         *
         * @return an immutable registry containing the registered codecs
         */
        public TextCodecRegistry build() {
            Map<Class<?>, TextCodec<?>> snapshot = Map.copyOf(codecs);
            return type -> type == null ? Optional.empty() : Optional.ofNullable(snapshot.get(type));
        }
    }
}
