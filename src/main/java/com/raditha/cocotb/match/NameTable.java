package com.raditha.cocotb.match;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Lookup table from dotted names to rule values.
 *
 * <p>
 * For a name written {@code a.b.C} the candidates are, in order of precedence:
 * <ol>
 * <li>the entry keyed {@code a.b.C}</li>
 * <li>entries keyed by a dotted suffix such as {@code b.C}, longer suffixes first</li>
 * <li>the entry keyed by the simple name {@code C}</li>
 * </ol>
 * The first candidate wins. Candidates with a different value are reported back as shadowed
 * so the caller can raise an ambiguity diagnostic.
 *
 * @param <V> rule value type
 */
public final class NameTable<V> {

    /**
     * How a lookup key was matched.
     */
    public enum MatchLevel {
        EXACT,
        SUFFIX,
        SIMPLE_NAME
    }

    /**
     * Outcome of a successful lookup.
     *
     * @param key      the winning entry's key
     * @param value    the winning entry's value
     * @param level    how the winning key matched
     * @param shadowed keys of lower-precedence candidates that carry a different value
     */
    public record Lookup<V>(String key, V value, MatchLevel level, List<String> shadowed) {
        public boolean isAmbiguous() {
            return !shadowed.isEmpty();
        }
    }

    private final Map<String, V> entries;

    private NameTable(Map<String, V> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /**
     * Builds a table; iteration order of {@code entries} is the declaration order.
     */
    public static <V> NameTable<V> of(Map<String, V> entries) {
        return new NameTable<>(entries);
    }

    public static <V> NameTable<V> empty() {
        return new NameTable<>(Map.of());
    }

    public Map<String, V> entries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Optional<V> exact(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    public Optional<Lookup<V>> lookup(String name) {
        List<Map.Entry<String, V>> candidates = new ArrayList<>();
        for (Map.Entry<String, V> entry : entries.entrySet()) {
            if (level(entry.getKey(), name) != null) {
                candidates.add(entry);
            }
        }
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        // stable sort keeps declaration order between equal ranks
        candidates.sort(Comparator.comparingInt(e -> rank(e.getKey(), name)));
        Map.Entry<String, V> winner = candidates.get(0);
        List<String> shadowed = new ArrayList<>();
        for (int i = 1; i < candidates.size(); i++) {
            if (!Objects.equals(candidates.get(i).getValue(), winner.getValue())) {
                shadowed.add(candidates.get(i).getKey());
            }
        }
        return Optional.of(new Lookup<>(winner.getKey(), winner.getValue(), level(winner.getKey(), name),
                List.copyOf(shadowed)));
    }

    private static MatchLevel level(String key, String name) {
        if (key.equals(name)) {
            return MatchLevel.EXACT;
        }
        if (!name.endsWith("." + key)) {
            return null;
        }
        return key.contains(".") ? MatchLevel.SUFFIX : MatchLevel.SIMPLE_NAME;
    }

    private static int rank(String key, String name) {
        if (key.equals(name)) {
            return 0;
        }
        return name.length() - key.length();
    }
}
