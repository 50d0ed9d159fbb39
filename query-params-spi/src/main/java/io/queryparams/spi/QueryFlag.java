package io.queryparams.spi;

import io.queryparams.core.ParsedQuery;
import io.queryparams.core.QueryLookup;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A boolean query parameter inferred from the presence of its key, e.g. {@code /books?published}.
 *
 * <p>True when the key is present without a value, or with exactly {@code true}, {@code 1} or an empty value.
 * Any other value, and absence, read as false. The first occurrence of a repeated key wins.
 *
 * <p>On the client, {@code true} appends the bare key and {@code false} leaves the request unchanged.
 */
public final class QueryFlag extends NamedCombinator<Boolean> {

    private static final Set<String> TRUTHY = Set.of("true", "1", "");

    QueryFlag(String name, Optional<String> description, List<String> values) {
        super(name, description, values);
    }

    /** Copy with a documentation description. */
    public QueryFlag describedAs(String description) {
        return new QueryFlag(name(), Optional.of(description), values());
    }

    /** Copy with documented sample values, e.g. the spellings a caller may send. */
    public QueryFlag withValues(String... values) {
        return new QueryFlag(name(), description(), List.of(values));
    }

    @Override
    public <R> R serve(ParsedQuery query, ServerContinuation<? super Boolean, R> next) {
        QueryLookup lookup = query.lookupSingle(name());
        boolean flag;
        if (lookup instanceof QueryLookup.PresentWithValue present) {
            flag = TRUTHY.contains(present.text());
        } else {
            flag = lookup instanceof QueryLookup.PresentNoValue;
        }
        return next.proceed(flag);
    }

    @Override
    public <R> R encode(OutgoingRequest request, Boolean argument, ClientContinuation<R> next) {
        return next.proceed(argument ? request.append(name(), Optional.empty()) : request);
    }

    @Override
    public Boolean coerceArgument(Object argument) {
        if (!(argument instanceof Boolean)) {
            throw badArgument("Boolean", argument);
        }
        return (Boolean) argument;
    }

    @Override
    public <R> R document(ActionDocs docs, DocsContinuation<R> next) {
        return next.proceed(docs.registerParam(docEntry(ParamKind.FLAG)));
    }
}
