package io.queryparams.spi;

import io.queryparams.core.TextCodec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Description of an endpoint's query parameters: a chain of {@link Combinator}s terminated by a {@link Leaf}.
 *
 * <p>Handler argument order, client argument order and documentation order all follow chain order.
 * Descriptors are immutable and may be shared between threads.
 *
 * <pre>{@code
 * RouteDescriptor books = RouteDescriptor.builder()
 *     .param("author", TextCodecs.string())
 *     .params("tags", TextCodecs.string())
 *     .flag("published")
 *     .leaf("List books");
 * }</pre>
 */
public sealed interface RouteDescriptor permits RouteDescriptor.Leaf, RouteDescriptor.Node {

    static Leaf leaf() {
        return Leaf.NO_SUMMARY;
    }

    static Leaf leaf(String summary) {
        return new Leaf(Optional.of(Objects.requireNonNull(summary, "summary")));
    }

    static Builder builder() {
        return new Builder();
    }

    /**
     * Combinators of the chain, head first.
     */
    default List<Combinator<?>> combinators() {
        List<Combinator<?>> out = new ArrayList<>();
        RouteDescriptor current = this;
        while (current instanceof Node<?> node) {
            out.add(node.combinator());
            current = node.next();
        }
        return out;
    }

    /**
     * Number of combinators before the leaf.
     */
    default int arity() {
        int n = 0;
        RouteDescriptor current = this;
        while (current instanceof Node<?> node) {
            n++;
            current = node.next();
        }
        return n;
    }

    /**
     * The terminal action.
     *
     * @param summary short description of the action (optional)
     */
    record Leaf(Optional<String> summary) implements RouteDescriptor {
        static final Leaf NO_SUMMARY = new Leaf(Optional.empty());

        public Leaf {
            summary = (summary == null) ? Optional.empty() : summary;
        }
    }

    /**
     * One combinator followed by the rest of the chain.
     */
    record Node<T>(Combinator<T> combinator, RouteDescriptor next) implements RouteDescriptor {
        public Node {
            Objects.requireNonNull(combinator, "combinator");
            Objects.requireNonNull(next, "next");
        }
    }

    /**
     * Builds a chain left to right.
     */
    final class Builder {
        private final List<Combinator<?>> combinators = new ArrayList<>();

        private Builder() {}

        /** Appends any combinator, including user-defined kinds. */
        public Builder with(Combinator<?> combinator) {
            combinators.add(Objects.requireNonNull(combinator, "combinator"));
            return this;
        }

        /** Appends a {@link QueryParam}. */
        public Builder param(String name, TextCodec<?> codec) {
            return with(Combinators.param(name, codec));
        }

        /** Appends a {@link QueryParams}. */
        public Builder params(String name, TextCodec<?> codec) {
            return with(Combinators.params(name, codec));
        }

        /** Appends a {@link QueryFlag}. */
        public Builder flag(String name) {
            return with(Combinators.flag(name));
        }

        public RouteDescriptor leaf() {
            return terminate(RouteDescriptor.leaf());
        }

        public RouteDescriptor leaf(String summary) {
            return terminate(RouteDescriptor.leaf(summary));
        }

        private RouteDescriptor terminate(Leaf leaf) {
            RouteDescriptor chain = leaf;
            for (int i = combinators.size() - 1; i >= 0; i--) {
                chain = combinators.get(i).then(chain);
            }
            return chain;
        }
    }
}
