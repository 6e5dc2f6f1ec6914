package io.github.cyfko.truthtable.core.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Mapping from variable names to boolean values.
 * <p>
 * Values are packed into the bits of a {@code long}: the first variable of the
 * {@link VariableSet} is the most significant bit. For variables {@code A, B}, index
 * {@code 0 → (0,0)}, {@code 1 → (0,1)}, {@code 2 → (1,0)}, {@code 3 → (1,1)}.
 * </p>
 *
 * <pre>{@code
 * Assignment a = Assignment.fromIndex(VariableSet.of("A", "B"), 2);
 * a.valueOf("A"); // true
 * a.valueOf("B"); // false
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Assignment {

    private final VariableSet variables;
    private final long bits;

    private Assignment(VariableSet variables, long bits) {
        this.variables = variables;
        this.bits = bits;
    }

    /**
     * Derives the assignment of row {@code index} of a truth table.
     *
     * @param variables the ordered variables, first one is the most significant bit
     * @param index     a row index in {@code 0 .. 2^n - 1}
     * @return the assignment
     * @throws IllegalArgumentException if the index is out of range
     */
    public static Assignment fromIndex(VariableSet variables, long index) {
        Objects.requireNonNull(variables, "variables cannot be null");
        int n = variables.size();
        if (n >= Long.SIZE - 1) {
            throw new IllegalArgumentException("Cannot index assignments over " + n + " variables");
        }
        if (index < 0 || index >= (1L << n)) {
            throw new IllegalArgumentException(String.format(
                    "Row index %d out of range for %d variable(s)", index, n));
        }
        return new Assignment(variables, index);
    }

    /**
     * Builds an assignment from explicit values, in map iteration order.
     *
     * @param values variable values
     * @return the assignment
     */
    public static Assignment of(Map<String, Boolean> values) {
        Objects.requireNonNull(values, "values cannot be null");
        List<String> names = new ArrayList<>(values.keySet());
        if (names.size() >= Long.SIZE - 1) {
            throw new IllegalArgumentException("Too many variables in assignment: " + names.size());
        }
        long bits = 0L;
        for (String name : names) {
            Boolean value = Objects.requireNonNull(values.get(name), () -> "No value for variable " + name);
            bits = (bits << 1) | (value ? 1L : 0L);
        }
        return new Assignment(VariableSet.of(names), bits);
    }

    public VariableSet variables() {
        return variables;
    }

    /**
     * @return the packed values, which is also the row index when built by {@link #fromIndex(VariableSet, long)}
     */
    public long index() {
        return bits;
    }

    public boolean isAssigned(String name) {
        return variables.contains(name);
    }

    /**
     * @param name a variable name
     * @return its value
     * @throws IllegalArgumentException if the variable has no value
     */
    public boolean valueOf(String name) {
        int column = variables.indexOf(name);
        if (column < 0) {
            throw new IllegalArgumentException("No value assigned to variable '" + name + "'");
        }
        return valueAt(column);
    }

    /**
     * @param column position of the variable in {@link #variables()}
     * @return its value
     */
    public boolean valueAt(int column) {
        int n = variables.size();
        if (column < 0 || column >= n) {
            throw new IndexOutOfBoundsException("Column " + column + " out of range for " + n + " variable(s)");
        }
        return ((bits >>> (n - 1 - column)) & 1L) == 1L;
    }

    public Map<String, Boolean> toMap() {
        Map<String, Boolean> map = new LinkedHashMap<>();
        for (int i = 0; i < variables.size(); i++) {
            map.put(variables.get(i), valueAt(i));
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Assignment)) return false;
        Assignment that = (Assignment) o;
        return bits == that.bits && variables.equals(that.variables);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variables, bits);
    }

    @Override
    public String toString() {
        return toMap().toString();
    }
}
