package io.queryparams.spi;

import io.queryparams.core.ParsedQuery;
import io.queryparams.core.QueryValue;
import io.queryparams.core.TextCodec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Zero or more occurrences of a query parameter, e.g. {@code /books?authors[]=Asimov&authors[]=Heinlein}.
 *
 * <p>Both {@code name} and {@code name[]} are accepted, mixed freely; decoded values keep their occurrence
 * order. Occurrences without a value, and values the codec cannot decode, are left out.
 *
 * <p>On the client each element is appended as its own {@code name=encoded} occurrence; an empty list leaves
 * the request unchanged.
 *
 * @param <T> the element type
 */
public final class QueryParams<T> extends NamedCombinator<List<T>> {

    private final TextCodec<T> codec;

    QueryParams(String name, TextCodec<T> codec, Optional<String> description, List<String> values) {
        super(name, description, values);
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public TextCodec<T> codec() {
        return codec;
    }

    /** Copy with a documentation description. */
    public QueryParams<T> describedAs(String description) {
        return new QueryParams<>(name(), codec, Optional.of(description), values());
    }

    /** Copy with documented sample values. */
    public QueryParams<T> withValues(String... values) {
        return new QueryParams<>(name(), codec, description(), List.of(values));
    }

    @Override
    public <R> R serve(ParsedQuery query, ServerContinuation<? super List<T>, R> next) {
        List<T> decoded = new ArrayList<>();
        for (QueryValue v : query.lookupAll(name())) {
            if (v instanceof QueryValue.Value value) {
                codec.decode(value.text()).ifPresent(decoded::add);
            }
        }
        return next.proceed(List.copyOf(decoded));
    }

    @Override
    public <R> R encode(OutgoingRequest request, List<T> argument, ClientContinuation<R> next) {
        OutgoingRequest current = request;
        for (T element : argument) {
            current = current.append(name(), Optional.of(codec.encode(element)));
        }
        return next.proceed(current);
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<T> coerceArgument(Object argument) {
        String expected = "List<" + codec.valueType().getSimpleName() + ">";
        if (!(argument instanceof List<?> list)) {
            throw badArgument(expected, argument);
        }
        for (Object element : list) {
            if (!codec.valueType().isInstance(element)) {
                throw badArgument(expected + " elements", element);
            }
        }
        return (List<T>) (List<?>) List.copyOf(list);
    }

    @Override
    public <R> R document(ActionDocs docs, DocsContinuation<R> next) {
        return next.proceed(docs.registerParam(docEntry(ParamKind.MULTI)));
    }
}
