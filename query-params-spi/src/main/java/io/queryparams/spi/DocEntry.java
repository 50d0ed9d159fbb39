package io.queryparams.spi;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Documentation of one query parameter.
 *
 * @param name the query key
 * @param kind how the parameter behaves
 * @param description free-form description (optional)
 * @param values sample values (may be empty)
 */
public record DocEntry(String name, ParamKind kind, Optional<String> description, List<String> values) {
    public DocEntry {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        description = (description == null) ? Optional.empty() : description;
        values = (values == null) ? List.of() : List.copyOf(values);
    }

    public static DocEntry of(String name, ParamKind kind) {
        return new DocEntry(name, kind, Optional.empty(), List.of());
    }
}
