package io.queryparams.spi;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class OutgoingRequestTest {

    @Test
    void appendReturnsNewValue() {
        OutgoingRequest base = OutgoingRequest.to(URI.create("http://localhost/books"));

        OutgoingRequest appended = base.append("author", Optional.of("Le Guin"));

        assertThat(base.params()).isEmpty();
        assertThat(appended.params()).hasSize(1);
        assertThat(appended.toUri()).isEqualTo(URI.create("http://localhost/books?author=Le+Guin"));
    }

    @Test
    void appendedParametersFollowAnExistingQueryAndPrecedeTheFragment() {
        OutgoingRequest request = OutgoingRequest.to(URI.create("http://localhost/books?sort=asc#top"))
                .append("published", Optional.empty())
                .append("tags[]", Optional.of("sf"));

        assertThat(request.toUri().toString()).isEqualTo("http://localhost/books?sort=asc&published&tags%5B%5D=sf#top");
    }

    @Test
    void withoutParametersTheBaseIsReturned() {
        URI base = URI.create("http://localhost/books?sort=asc");

        assertThat(OutgoingRequest.to(base).toUri()).isSameAs(base);
        assertThat(OutgoingRequest.to(base).queryString()).isEmpty();
    }

    @Test
    void charsetSurvivesAppendAndDrivesRendering() {
        OutgoingRequest request = OutgoingRequest.to(URI.create("http://localhost/books"), StandardCharsets.ISO_8859_1)
                .append("author", Optional.of("Brontë"));

        assertThat(request.charset()).isEqualTo(StandardCharsets.ISO_8859_1);
        assertThat(request.queryString()).isEqualTo("author=Bront%EB");
        assertThat(request.withCharset(StandardCharsets.UTF_8).queryString()).isEqualTo("author=Bront%C3%AB");
        assertThat(request).isNotEqualTo(request.withCharset(StandardCharsets.UTF_8));
    }
}
