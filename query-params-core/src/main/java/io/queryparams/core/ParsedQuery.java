package io.queryparams.core;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered multi-map view of a query string.
 *
 * <p>Entries keep their occurrence order and duplicates are preserved. Instances are immutable and
 * are created once per request by {@link QueryString#parse(String)}.
 */
public final class ParsedQuery {

    private static final ParsedQuery EMPTY = new ParsedQuery(List.of());

    /** Suffix of the array-style form of a key, as in {@code tags[]=a}. */
    public static final String ARRAY_SUFFIX = "[]";

    private final List<Entry> entries;

    ParsedQuery(List<Entry> entries) {
        this.entries = List.copyOf(entries);
    }

    public static ParsedQuery empty() {
        return EMPTY;
    }

    public static ParsedQuery of(List<Entry> entries) {
        Objects.requireNonNull(entries, "entries");
        return entries.isEmpty() ? EMPTY : new ParsedQuery(entries);
    }

    public List<Entry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Distinct keys in order of first occurrence.
     */
    public Set<String> keys() {
        Set<String> keys = new LinkedHashSet<>();
        for (Entry e : entries) {
            keys.add(e.key());
        }
        return keys;
    }

    /**
     * Looks up {@code name}; when the key occurs more than once the first occurrence wins.
     */
    public QueryLookup lookupSingle(String name) {
        Objects.requireNonNull(name, "name");
        for (Entry e : entries) {
            if (e.key().equals(name)) return QueryLookup.of(e.value());
        }
        return QueryLookup.absent();
    }

    /**
     * Every value stored under {@code name} or {@code name[]}, in occurrence order.
     */
    public List<QueryValue> lookupAll(String name) {
        Objects.requireNonNull(name, "name");
        String arrayName = name + ARRAY_SUFFIX;
        List<QueryValue> out = new ArrayList<>();
        for (Entry e : entries) {
            if (e.key().equals(name) || e.key().equals(arrayName)) {
                out.add(e.value());
            }
        }
        return out;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof ParsedQuery)) return false;
        return entries.equals(((ParsedQuery) other).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "ParsedQuery" + entries;
    }

    /**
     * One token of the query string.
     *
     * @param key the text before the first {@code =}, or the whole token
     * @param value the stored value
     */
    public record Entry(String key, QueryValue value) {
        public Entry {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }
    }
}
