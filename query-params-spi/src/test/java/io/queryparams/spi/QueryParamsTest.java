package io.queryparams.spi;

import io.queryparams.core.QueryParamsException;
import io.queryparams.core.QueryString;
import io.queryparams.core.TextCodecs;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryParamsTest {

    private final QueryParams<Integer> ids = Combinators.params("a", TextCodecs.integer());

    @Test
    void plainAndArrayStyleKeysKeepOccurrenceOrder() {
        assertThat(serve("a=1&a=2&a[]=3")).containsExactly(1, 2, 3);
        assertThat(serve("a[]=3&b=0&a=1")).containsExactly(3, 1);
    }

    @Test
    void unparsableEntriesAreDropped() {
        assertThat(serve("a=1&a=xyz&a=3")).containsExactly(1, 3);
    }

    @Test
    void valuelessEntriesContributeNothing() {
        assertThat(serve("a&a=2&a[]")).containsExactly(2);
        assertThat(serve("a=")).isEmpty();
    }

    @Test
    void missingKeyDecodesToEmptyList() {
        assertThat(serve("")).isEmpty();
        assertThat(serve("ab=1&a[1]=2")).isEmpty();
    }

    @Test
    void eachElementIsAppendedAsItsOwnOccurrence() {
        OutgoingRequest encoded = ids.encode(base(), List.of(3, 1, 3), r -> r);

        assertThat(encoded.queryString()).isEqualTo("a=3&a=1&a=3");
        assertThat(serve(encoded.queryString())).containsExactly(3, 1, 3);
    }

    @Test
    void emptyListLeavesRequestUnchanged() {
        OutgoingRequest encoded = ids.encode(base(), List.of(), r -> r);

        assertThat(encoded).isEqualTo(base());
        assertThat(encoded.queryString()).isEmpty();
    }

    @Test
    void coerceArgumentAcceptsListsOfTheElementType() {
        assertThat(ids.coerceArgument(List.of(7, 3, 7))).containsExactly(7, 3, 7);
        assertThat(ids.coerceArgument(List.of())).isEmpty();
        assertThatThrownBy(() -> ids.coerceArgument(List.of("1")))
                .isInstanceOf(QueryParamsException.RouteComposition.class)
                .hasMessageContaining("List<Integer>");
        assertThatThrownBy(() -> ids.coerceArgument(1))
                .isInstanceOf(QueryParamsException.RouteComposition.class);
    }

    @Test
    void coerceArgumentRejectsUnorderedCollections() {
        assertThatThrownBy(() -> ids.coerceArgument(Set.of(7)))
                .isInstanceOf(QueryParamsException.RouteComposition.class)
                .hasMessageContaining("List<Integer>");
    }

    @Test
    void documentsAsMulti() {
        ActionDocs docs = ids.document(ActionDocs.empty(), d -> d);

        assertThat(docs.params()).containsExactly(DocEntry.of("a", ParamKind.MULTI));
    }

    private List<Integer> serve(String query) {
        return ids.serve(QueryString.parse(query), value -> value);
    }

    private static OutgoingRequest base() {
        return OutgoingRequest.to(URI.create("http://localhost/books"));
    }
}
