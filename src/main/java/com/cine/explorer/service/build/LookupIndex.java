package com.cine.explorer.service.build;

import java.util.*;
import java.util.function.Function;

/**
 * Immutable in-memory multimap from a movie or person identifier to its
 * associated values, built by draining a {@link RelationReader} once.
 * <p>
 * Values keep the order in which the relation produced them. Lookups of
 * unknown keys return an empty list, never null.
 *
 * @param <V> associated value type
 */
public final class LookupIndex<V> {

    private final Map<String, List<V>> entries;
    private final long valueCount;

    private LookupIndex(Map<String, List<V>> entries, long valueCount) {
        this.entries = entries;
        this.valueCount = valueCount;
    }

    /**
     * Multi-valued association: every row contributes one value under its key.
     */
    public static <R, V> LookupIndex<V> build(RelationReader<R> reader,
                                              Function<? super R, String> keyFn,
                                              Function<? super R, ? extends V> valueFn) {
        Map<String, List<V>> acc = new HashMap<>();
        long rows = reader.drain(row ->
                acc.computeIfAbsent(keyFn.apply(row), k -> new ArrayList<>()).add(valueFn.apply(row)));

        Map<String, List<V>> frozen = new HashMap<>(acc.size() * 4 / 3 + 1);
        acc.forEach((k, v) -> frozen.put(k, Collections.unmodifiableList(v)));
        return new LookupIndex<>(frozen, rows);
    }

    /**
     * Single-valued association. Duplicate keys are not rejected: the last row wins.
     * A null value is stored like in {@link #build}; {@link #first(String)} then reports it as absent.
     */
    public static <R, V> LookupIndex<V> buildUnique(RelationReader<R> reader,
                                                    Function<? super R, String> keyFn,
                                                    Function<? super R, ? extends V> valueFn) {
        Map<String, List<V>> acc = new HashMap<>();
        reader.drain(row -> acc.put(keyFn.apply(row), Collections.singletonList(valueFn.apply(row))));
        return new LookupIndex<>(acc, acc.size());
    }

    public List<V> get(String key) {
        return entries.getOrDefault(key, List.of());
    }

    public Optional<V> first(String key) {
        List<V> values = entries.get(key);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.ofNullable(values.get(0));
    }

    public int keyCount() {
        return entries.size();
    }

    public long valueCount() {
        return valueCount;
    }
}
