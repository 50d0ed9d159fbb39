package io.queryparams.docs;

import io.queryparams.spi.ActionDocs;
import io.queryparams.spi.RouteDescriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Documentation of several endpoints, keyed by endpoint name in registration order.
 *
 * <pre>{@code
 * ApiDocs docs = ApiDocs.builder()
 *     .document("GET /books", booksRoute)
 *     .document("GET /authors", authorsRoute)
 *     .build();
 * }</pre>
 */
public final class ApiDocs {
    private final Map<String, ActionDocs> endpoints;

    private ApiDocs(Map<String, ActionDocs> endpoints) {
        this.endpoints = endpoints;
    }

    public static Builder builder() {
        return new Builder(DocsInterpreter.create());
    }

    public Map<String, ActionDocs> endpoints() {
        return endpoints;
    }

    public Optional<ActionDocs> endpoint(String name) {
        return Optional.ofNullable(endpoints.get(name));
    }

    /**
     * Builder for {@link ApiDocs}.
     */
    public static final class Builder {
        private final DocsInterpreter interpreter;
        private final Map<String, ActionDocs> endpoints = new LinkedHashMap<>();

        private Builder(DocsInterpreter interpreter) {
            this.interpreter = interpreter;
        }

        /**
         * Documents {@code route} under {@code name}.
         *
         * @throws IllegalArgumentException if {@code name} is already documented
         */
        public Builder document(String name, RouteDescriptor route) {
            Objects.requireNonNull(name, "name");
            ActionDocs docs = interpreter.docsFor(route);
            if (endpoints.putIfAbsent(name, docs) != null) {
                throw new IllegalArgumentException("endpoint already documented: " + name);
            }
            return this;
        }

        public ApiDocs build() {
            return new ApiDocs(Collections.unmodifiableMap(new LinkedHashMap<>(endpoints)));
        }
    }
}
