package io.queryparams.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * {@link TextCodecRegistry} backed by {@link java.util.ServiceLoader}.
 *
 * <p>Resolves:
 * <ul>
 *   <li>the {@link TextCodecs#builtIns() built-in} codecs</li>
 *   <li>every codec contributed by a registered {@link TextCodecProvider}, overriding a built-in
 *       for the same type</li>
 * </ul>
 */
public final class ServiceLoaderTextCodecRegistry implements TextCodecRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(ServiceLoaderTextCodecRegistry.class);

    private final Map<Class<?>, TextCodec<?>> byType;

    public ServiceLoaderTextCodecRegistry(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Map<Class<?>, TextCodec<?>> map = new HashMap<>();
        for (TextCodec<?> c : TextCodecs.builtIns()) {
            map.put(c.valueType(), c);
        }

        ServiceLoader<TextCodecProvider> loader = ServiceLoader.load(TextCodecProvider.class, cl);
        for (TextCodecProvider p : loader) {
            LOGGER.debug("Loading text codecs from {}", p.getClass().getName());
            for (TextCodec<?> c : p.codecs()) {
                if (c == null || c.valueType() == null) continue;
                TextCodec<?> previous = map.put(c.valueType(), c);
                if (previous != null) {
                    LOGGER.debug("Codec for {} from {} replaces {}", c.valueType().getName(), p.getClass().getName(), previous);
                }
            }
        }
        this.byType = Map.copyOf(map);
    }

    public static ServiceLoaderTextCodecRegistry defaultRegistry() {
        return new ServiceLoaderTextCodecRegistry(Thread.currentThread().getContextClassLoader());
    }

    @Override
    public Optional<TextCodec<?>> lookup(Class<?> type) {
        if (type == null) return Optional.empty();
        return Optional.ofNullable(byType.get(type));
    }
}
