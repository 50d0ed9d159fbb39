package io.queryparams.docs;

import io.queryparams.spi.ActionDocs;
import io.queryparams.spi.Combinator;
import io.queryparams.spi.RouteDescriptor;

import java.util.Objects;

/**
 * Interprets a {@link RouteDescriptor} into the documentation of its action.
 *
 * <p>Each combinator registers one {@link io.queryparams.spi.DocEntry}, in chain order. The leaf contributes
 * its summary, if it has one.
 */
public final class DocsInterpreter {

    private static final DocsInterpreter INSTANCE = new DocsInterpreter();

    private DocsInterpreter() {}

    public static DocsInterpreter create() {
        return INSTANCE;
    }

    public ActionDocs docsFor(RouteDescriptor route) {
        return docsFor(route, ActionDocs.empty());
    }

    /**
     * Documents {@code route} on top of {@code seed}, e.g. docs already produced by path or verb combinators.
     */
    public ActionDocs docsFor(RouteDescriptor route, ActionDocs seed) {
        Objects.requireNonNull(route, "route");
        Objects.requireNonNull(seed, "seed");
        if (route instanceof RouteDescriptor.Node<?> node) {
            return step(node, seed);
        }
        RouteDescriptor.Leaf leaf = (RouteDescriptor.Leaf) route;
        return leaf.summary().map(seed::withSummary).orElse(seed);
    }

    private <T> ActionDocs step(RouteDescriptor.Node<T> node, ActionDocs docs) {
        Combinator<T> combinator = node.combinator();
        return combinator.document(docs, next -> docsFor(node.next(), next));
    }
}
