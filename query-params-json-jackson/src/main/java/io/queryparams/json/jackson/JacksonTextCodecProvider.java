package io.queryparams.json.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import io.queryparams.core.TextCodec;
import io.queryparams.core.TextCodecProvider;

import java.util.List;

/**
 * ServiceLoader provider for a {@link JsonNode} {@link JacksonTextCodec}.
 */
public final class JacksonTextCodecProvider implements TextCodecProvider {
    @Override
    public List<TextCodec<?>> codecs() {
        return List.of(JacksonTextCodec.of(JsonNode.class));
    }
}
