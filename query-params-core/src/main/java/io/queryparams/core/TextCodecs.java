package io.queryparams.core;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Built-in {@link TextCodec}s for common value types.
 */
public final class TextCodecs {
    private TextCodecs() {}

    private static final TextCodec<String> STRING = TextCodec.of(String.class, Optional::of, Function.identity());
    private static final TextCodec<Integer> INTEGER = parsing(Integer.class, Integer::valueOf, String::valueOf);
    private static final TextCodec<Long> LONG = parsing(Long.class, Long::valueOf, String::valueOf);
    private static final TextCodec<Double> DOUBLE = parsing(Double.class, Double::valueOf, String::valueOf);
    private static final TextCodec<BigDecimal> DECIMAL = parsing(BigDecimal.class, BigDecimal::new, BigDecimal::toPlainString);
    private static final TextCodec<UUID> UUID_CODEC = parsing(UUID.class, UUID::fromString, UUID::toString);
    private static final TextCodec<LocalDate> LOCAL_DATE = parsing(LocalDate.class, LocalDate::parse, LocalDate::toString);
    private static final TextCodec<LocalDateTime> LOCAL_DATE_TIME =
            parsing(LocalDateTime.class, LocalDateTime::parse, LocalDateTime::toString);
    private static final TextCodec<Boolean> BOOLEAN = TextCodec.of(Boolean.class, TextCodecs::parseBoolean, String::valueOf);

    public static TextCodec<String> string() {
        return STRING;
    }

    public static TextCodec<Integer> integer() {
        return INTEGER;
    }

    public static TextCodec<Long> longs() {
        return LONG;
    }

    public static TextCodec<Double> doubles() {
        return DOUBLE;
    }

    public static TextCodec<BigDecimal> decimal() {
        return DECIMAL;
    }

    public static TextCodec<UUID> uuid() {
        return UUID_CODEC;
    }

    /** ISO-8601 date, e.g. {@code 2024-05-01}. */
    public static TextCodec<LocalDate> localDate() {
        return LOCAL_DATE;
    }

    /** ISO-8601 date-time without offset, e.g. {@code 2024-05-01T10:15:30}. */
    public static TextCodec<LocalDateTime> localDateTime() {
        return LOCAL_DATE_TIME;
    }

    /**
     * Accepts exactly {@code true} and {@code false}.
     */
    public static TextCodec<Boolean> bool() {
        return BOOLEAN;
    }

    /**
     * Enum constants by {@link Enum#name()}, case-sensitive.
     */
    public static <E extends Enum<E>> TextCodec<E> enumOf(Class<E> type) {
        Objects.requireNonNull(type, "type");
        return parsing(type, text -> Enum.valueOf(type, text), Enum::name);
    }

    /**
     * All built-in codecs, in registration order.
     */
    public static List<TextCodec<?>> builtIns() {
        return List.of(STRING, INTEGER, LONG, DOUBLE, DECIMAL, UUID_CODEC, LOCAL_DATE, LOCAL_DATE_TIME, BOOLEAN);
    }

    private static Optional<Boolean> parseBoolean(String text) {
        if ("true".equals(text)) return Optional.of(Boolean.TRUE);
        if ("false".equals(text)) return Optional.of(Boolean.FALSE);
        return Optional.empty();
    }

    private static <T> TextCodec<T> parsing(Class<T> type, Function<String, T> parser, Function<? super T, String> encoder) {
        return TextCodec.of(type, text -> {
            if (text == null) return Optional.empty();
            try {
                return Optional.of(parser.apply(text));
            } catch (IllegalArgumentException | DateTimeException e) {
                // unparsable text reads as absent
                return Optional.empty();
            }
        }, encoder);
    }
}
