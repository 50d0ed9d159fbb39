package io.queryparams.server;

import io.queryparams.core.QueryLookup;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ServerRequestTest {

    @Test
    void uriQueryIsDecodedPerToken() {
        ServerRequest request = ServerRequest.of("GET", URI.create("http://localhost/s?q=a%26b&flag"));

        assertThat(request.parseQuery(StandardCharsets.UTF_8).lookupSingle("q"))
                .isEqualTo(new QueryLookup.PresentWithValue("a&b"));
        assertThat(request.parseQuery(StandardCharsets.UTF_8).lookupSingle("flag"))
                .isInstanceOf(QueryLookup.PresentNoValue.class);
    }

    @Test
    void missingQueryParsesEmpty() {
        assertThat(ServerRequest.of("GET", URI.create("http://localhost/s")).parseQuery(StandardCharsets.UTF_8).isEmpty())
                .isTrue();
        assertThat(ServerRequest.withDecodedQuery("GET", URI.create("http://localhost/s"), null)
                .parseQuery(StandardCharsets.UTF_8).isEmpty()).isTrue();
    }

    @Test
    void plusDecodesAsSpace() {
        ServerRequest request = ServerRequest.of("GET", URI.create("http://localhost/s?q=a+b"));

        assertThat(request.parseQuery(StandardCharsets.UTF_8).lookupSingle("q"))
                .isEqualTo(new QueryLookup.PresentWithValue("a b"));
    }
}
