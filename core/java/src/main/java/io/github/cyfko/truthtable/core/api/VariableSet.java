package io.github.cyfko.truthtable.core.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered set of distinct variable names.
 * <p>
 * The order is the order of first occurrence in a left-to-right scan of the expression
 * text. It fixes both the column order of the truth table and the bit order of each
 * assignment: the first variable is the most significant bit of the row index.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class VariableSet implements Iterable<String> {

    private final List<String> names;
    private final Map<String, Integer> indexes;

    private VariableSet(List<String> names) {
        this.names = Collections.unmodifiableList(names);
        this.indexes = new HashMap<>(names.size() * 2);
        for (int i = 0; i < names.size(); i++) {
            indexes.put(names.get(i), i);
        }
    }

    /**
     * Builds a set from names in their first-occurrence order; later duplicates are ignored.
     *
     * @param names variable names, in scan order
     * @return the ordered, duplicate-free set
     */
    public static VariableSet of(List<String> names) {
        Objects.requireNonNull(names, "names cannot be null");
        return new VariableSet(new ArrayList<>(new LinkedHashSet<>(names)));
    }

    public static VariableSet of(String... names) {
        return of(List.of(names));
    }

    public int size() {
        return names.size();
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    public String get(int index) {
        return names.get(index);
    }

    public boolean contains(String name) {
        return indexes.containsKey(name);
    }

    /**
     * @param name a variable name
     * @return its column index, or {@code -1} if absent
     */
    public int indexOf(String name) {
        return indexes.getOrDefault(name, -1);
    }

    public List<String> names() {
        return names;
    }

    @Override
    public Iterator<String> iterator() {
        return names.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariableSet)) return false;
        return names.equals(((VariableSet) o).names);
    }

    @Override
    public int hashCode() {
        return names.hashCode();
    }

    @Override
    public String toString() {
        return names.toString();
    }

    /**
     * Mutable accumulator used while scanning an expression.
     */
    public static final class Builder {
        private final LinkedHashSet<String> names = new LinkedHashSet<>();

        /**
         * @param name a variable just read
         * @return {@code true} if this is its first occurrence
         */
        public boolean add(String name) {
            return names.add(name);
        }

        public int size() {
            return names.size();
        }

        public VariableSet build() {
            return new VariableSet(new ArrayList<>(names));
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
