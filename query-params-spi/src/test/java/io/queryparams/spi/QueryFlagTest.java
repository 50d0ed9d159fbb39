package io.queryparams.spi;

import io.queryparams.core.QueryParamsException;
import io.queryparams.core.QueryString;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.URI;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryFlagTest {

    private final QueryFlag flag = Combinators.flag("f");

    @ParameterizedTest
    @ValueSource(strings = {"f", "f=true", "f=1", "f=", "x=0&f"})
    void truthyForms(String query) {
        assertThat(serve(query)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"f=false", "f=0", "f=no", "f=TRUE", "f=yes", "", "g", "f[]"})
    void falsyForms(String query) {
        assertThat(serve(query)).isFalse();
    }

    @Test
    void firstOccurrenceDecides() {
        assertThat(serve("f=0&f=1")).isFalse();
        assertThat(serve("f&f=0")).isTrue();
    }

    @Test
    void trueAppendsBareKeyAndFalseIsANoOp() {
        OutgoingRequest base = OutgoingRequest.to(URI.create("http://localhost/books"));

        assertThat(flag.encode(base, true, r -> r).queryString()).isEqualTo("f");
        OutgoingRequest unchanged = flag.encode(base, false, r -> r);
        assertThat(unchanged).isEqualTo(base);
        assertThat(serve(flag.encode(base, true, r -> r).queryString())).isTrue();
    }

    @Test
    void coerceArgumentRequiresBoolean() {
        assertThat(flag.coerceArgument(Boolean.TRUE)).isTrue();
        assertThatThrownBy(() -> flag.coerceArgument("true"))
                .isInstanceOf(QueryParamsException.RouteComposition.class)
                .hasMessageContaining("Boolean");
    }

    @Test
    void documentsAsFlag() {
        ActionDocs docs = flag.describedAs("Only published books").document(ActionDocs.empty(), d -> d);

        assertThat(docs.params()).singleElement().satisfies(entry -> {
            assertThat(entry.name()).isEqualTo("f");
            assertThat(entry.kind()).isEqualTo(ParamKind.FLAG);
            assertThat(entry.description()).contains("Only published books");
        });
    }

    @Test
    void documentedValuesAreKeptAlongsideDescription() {
        QueryFlag published = flag.describedAs("Only published books").withValues("true", "1");
        ActionDocs docs = published.document(ActionDocs.empty(), d -> d);

        assertThat(docs.params()).containsExactly(new DocEntry(
                "f", ParamKind.FLAG, Optional.of("Only published books"), List.of("true", "1")));
        assertThat(serve("f=1")).isTrue();
    }

    private boolean serve(String query) {
        return flag.serve(QueryString.parse(query), value -> value);
    }
}
