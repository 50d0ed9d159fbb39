package io.queryparams.spi;

import io.queryparams.core.TextCodec;
import io.queryparams.core.TextCodecRegistry;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Factories for the built-in combinators.
 */
public final class Combinators {
    private Combinators() {}

    public static <T> QueryParam<T> param(String name, TextCodec<T> codec) {
        return new QueryParam<>(name, codec, Optional.empty(), List.of());
    }

    /**
     * Single optional parameter whose codec is resolved from {@code registry}.
     *
     * @throws io.queryparams.core.QueryParamsException.MissingCodec if the registry has no codec for {@code type}
     */
    public static <T> QueryParam<T> param(String name, Class<T> type, TextCodecRegistry registry) {
        Objects.requireNonNull(registry, "registry");
        return param(name, registry.require(type));
    }

    public static <T> QueryParams<T> params(String name, TextCodec<T> codec) {
        return new QueryParams<>(name, codec, Optional.empty(), List.of());
    }

    /**
     * Multi-value parameter whose codec is resolved from {@code registry}.
     *
     * @throws io.queryparams.core.QueryParamsException.MissingCodec if the registry has no codec for {@code type}
     */
    public static <T> QueryParams<T> params(String name, Class<T> type, TextCodecRegistry registry) {
        Objects.requireNonNull(registry, "registry");
        return params(name, registry.require(type));
    }

    public static QueryFlag flag(String name) {
        return new QueryFlag(name, Optional.empty(), List.of());
    }
}
