package io.queryparams.json.jackson;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.queryparams.core.QueryParamsException;
import io.queryparams.core.TextCodec;

import java.util.Objects;
import java.util.Optional;

/**
 * Jackson implementation of {@link TextCodec} for parameters whose values are JSON documents,
 * e.g. {@code filter={"genre":"sf"}}.
 *
 * @param <T> the value type
 */
public final class JacksonTextCodec<T> implements TextCodec<T> {
    private final ObjectMapper mapper;
    private final Class<T> type;

    /**
     * Creates a codec with the default ObjectMapper.
     */
    public JacksonTextCodec(Class<T> type) {
        this(new ObjectMapper(new JsonFactory()), type);
    }

    /**
     * Creates a codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     * @param type the value type
     */
    public JacksonTextCodec(ObjectMapper mapper, Class<T> type) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.type = Objects.requireNonNull(type, "type");
    }

    public static <T> JacksonTextCodec<T> of(Class<T> type) {
        return new JacksonTextCodec<>(type);
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public Class<T> valueType() {
        return type;
    }

    @Override
    public Optional<T> decode(String text) {
        if (text == null || text.isEmpty()) return Optional.empty();
        try {
            return Optional.ofNullable(mapper.readValue(text, type));
        } catch (JsonProcessingException e) {
            // malformed JSON reads as absent
            return Optional.empty();
        }
    }

    @Override
    public String encode(T value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new QueryParamsException.TextEncoding("Failed to serialize " + type.getName() + " to JSON", e);
        }
    }

    @Override
    public String toString() {
        return "JacksonTextCodec[" + type.getSimpleName() + "]";
    }
}
