package io.queryparams.docs;

import io.queryparams.core.ParsedQuery;
import io.queryparams.core.QueryLookup;
import io.queryparams.core.QueryParamsException;
import io.queryparams.core.TextCodec;
import io.queryparams.spi.ActionDocs;
import io.queryparams.spi.ClientContinuation;
import io.queryparams.spi.Combinator;
import io.queryparams.spi.DocEntry;
import io.queryparams.spi.DocsContinuation;
import io.queryparams.spi.OutgoingRequest;
import io.queryparams.spi.ParamKind;
import io.queryparams.spi.ServerContinuation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A combinator kind defined outside the library: values joined by commas under one key, {@code ids=1,2,3}.
 */
final class CsvParam<T> implements Combinator<List<T>> {
    static final ParamKind CSV = new ParamKind("csv");

    private final String name;
    private final TextCodec<T> codec;

    CsvParam(String name, TextCodec<T> codec) {
        this.name = name;
        this.codec = codec;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public <R> R serve(ParsedQuery query, ServerContinuation<? super List<T>, R> next) {
        List<T> out = new ArrayList<>();
        QueryLookup lookup = query.lookupSingle(name);
        if (lookup instanceof QueryLookup.PresentWithValue present && !present.text().isEmpty()) {
            for (String part : present.text().split(",")) {
                codec.decode(part).ifPresent(out::add);
            }
        }
        return next.proceed(out);
    }

    @Override
    public <R> R encode(OutgoingRequest request, List<T> argument, ClientContinuation<R> next) {
        if (argument.isEmpty()) return next.proceed(request);
        String joined = argument.stream().map(codec::encode).collect(Collectors.joining(","));
        return next.proceed(request.append(name, Optional.of(joined)));
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<T> coerceArgument(Object argument) {
        if (!(argument instanceof List<?>)) {
            throw new QueryParamsException.RouteComposition("'" + name + "' expects a List");
        }
        return (List<T>) argument;
    }

    @Override
    public <R> R document(ActionDocs docs, DocsContinuation<R> next) {
        return next.proceed(docs.registerParam(DocEntry.of(name, CSV)));
    }
}
