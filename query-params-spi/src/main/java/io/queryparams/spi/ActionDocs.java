package io.queryparams.spi;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Accumulated documentation of one endpoint action.
 *
 * <p>Immutable: {@link #registerParam(DocEntry)} and {@link #withSummary(String)} return updated copies.
 */
public final class ActionDocs {

    private static final ActionDocs EMPTY = new ActionDocs(Optional.empty(), List.of());

    private final Optional<String> summary;
    private final List<DocEntry> params;

    private ActionDocs(Optional<String> summary, List<DocEntry> params) {
        this.summary = summary;
        this.params = params;
    }

    public static ActionDocs empty() {
        return EMPTY;
    }

    public Optional<String> summary() {
        return summary;
    }

    /**
     * Parameter entries in registration order.
     */
    public List<DocEntry> params() {
        return params;
    }

    public ActionDocs registerParam(DocEntry entry) {
        Objects.requireNonNull(entry, "entry");
        List<DocEntry> next = new ArrayList<>(params.size() + 1);
        next.addAll(params);
        next.add(entry);
        return new ActionDocs(summary, List.copyOf(next));
    }

    public ActionDocs withSummary(String summary) {
        Objects.requireNonNull(summary, "summary");
        return new ActionDocs(Optional.of(summary), params);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof ActionDocs)) return false;
        ActionDocs that = (ActionDocs) other;
        return summary.equals(that.summary) && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(summary, params);
    }

    @Override
    public String toString() {
        return "ActionDocs{summary=" + summary.orElse("") + ", params=" + params + "}";
    }
}
