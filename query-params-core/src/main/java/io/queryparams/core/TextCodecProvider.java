package io.queryparams.core;

import java.util.List;

/**
 * ServiceLoader provider for {@link TextCodec}s.
 *
 * <p>Modules such as {@code query-params-json-jackson} register implementations
 * via {@code META-INF/services}.
 */
public interface TextCodecProvider {
    List<TextCodec<?>> codecs();
}
