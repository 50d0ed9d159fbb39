package io.queryparams.spi;

import io.queryparams.core.ParsedQuery;
import io.queryparams.core.QueryLookup;
import io.queryparams.core.TextCodec;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A single optional query parameter, e.g. {@code /books?author=Asimov}.
 *
 * <p>The handler receives {@link Optional#empty()} when the key is absent, present without a value, or
 * present with a value the codec cannot decode. The first occurrence of a repeated key wins.
 *
 * <p>On the client, {@link Optional#empty()} leaves the request unchanged; a value is appended as
 * {@code name=encoded}.
 *
 * @param <T> the value type
 */
public final class QueryParam<T> extends NamedCombinator<Optional<T>> {

    private final TextCodec<T> codec;

    QueryParam(String name, TextCodec<T> codec, Optional<String> description, List<String> values) {
        super(name, description, values);
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public TextCodec<T> codec() {
        return codec;
    }

    /** Copy with a documentation description. */
    public QueryParam<T> describedAs(String description) {
        return new QueryParam<>(name(), codec, Optional.of(description), values());
    }

    /** Copy with documented sample values. */
    public QueryParam<T> withValues(String... values) {
        return new QueryParam<>(name(), codec, description(), List.of(values));
    }

    @Override
    public <R> R serve(ParsedQuery query, ServerContinuation<? super Optional<T>, R> next) {
        QueryLookup lookup = query.lookupSingle(name());
        Optional<T> value = Optional.empty();
        if (lookup instanceof QueryLookup.PresentWithValue present) {
            value = codec.decode(present.text());
        }
        return next.proceed(value);
    }

    @Override
    public <R> R encode(OutgoingRequest request, Optional<T> argument, ClientContinuation<R> next) {
        if (argument.isEmpty()) return next.proceed(request);
        return next.proceed(request.append(name(), Optional.of(codec.encode(argument.get()))));
    }

    @Override
    @SuppressWarnings("unchecked")
    public Optional<T> coerceArgument(Object argument) {
        if (!(argument instanceof Optional<?> optional)) {
            throw badArgument("Optional<" + codec.valueType().getSimpleName() + ">", argument);
        }
        if (optional.isPresent() && !codec.valueType().isInstance(optional.get())) {
            throw badArgument("Optional<" + codec.valueType().getSimpleName() + ">",
                    optional.get());
        }
        return (Optional<T>) optional;
    }

    @Override
    public <R> R document(ActionDocs docs, DocsContinuation<R> next) {
        return next.proceed(docs.registerParam(docEntry(ParamKind.SINGLE_OPTIONAL)));
    }
}
