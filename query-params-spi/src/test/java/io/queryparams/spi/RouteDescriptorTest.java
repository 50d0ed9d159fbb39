package io.queryparams.spi;

import io.queryparams.core.TextCodecs;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class RouteDescriptorTest {

    @Test
    void builderChainsCombinatorsInDeclarationOrder() {
        RouteDescriptor route = RouteDescriptor.builder()
                .param("author", TextCodecs.string())
                .params("tags", TextCodecs.string())
                .flag("published")
                .leaf("List books");

        assertThat(route.arity()).isEqualTo(3);
        assertThat(route.combinators()).extracting(Combinator::name).containsExactly("author", "tags", "published");
        assertThat(route.combinators().get(1)).isInstanceOf(QueryParams.class);

        RouteDescriptor tail = route;
        while (tail instanceof RouteDescriptor.Node<?> node) {
            tail = node.next();
        }
        assertThat(tail).isEqualTo(new RouteDescriptor.Leaf(Optional.of("List books")));
    }

    @Test
    void thenPrependsToAnExistingChain() {
        RouteDescriptor tail = Combinators.flag("b").then(RouteDescriptor.leaf());
        RouteDescriptor route = Combinators.param("a", TextCodecs.integer()).then(tail);

        assertThat(route.combinators()).extracting(Combinator::name).containsExactly("a", "b");
        assertThat(((RouteDescriptor.Node<?>) route).next()).isSameAs(tail);
    }

    @Test
    void leafAloneHasNoCombinators() {
        assertThat(RouteDescriptor.leaf().arity()).isZero();
        assertThat(RouteDescriptor.builder().leaf().combinators()).isEmpty();
        assertThat(RouteDescriptor.leaf().summary()).isEmpty();
    }
}
