package io.memframe.kernel;

import io.memframe.core.DuplicateColumnException;
import io.memframe.core.LengthMismatchException;
import io.memframe.core.UnknownColumnException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bidirectional mapping between column names and 0-based positions.
 * <p>
 * <b>Invariants:</b>
 * <ul>
 *   <li>Every position in {@code [0, size())} has exactly one name.</li>
 *   <li>Names are unique and non-null.</li>
 *   <li>The ordered name list and the name-to-position map always agree.</li>
 * </ul>
 */
public final class ColumnIndex {

    private final List<String> names;
    private final Map<String, Integer> positions;

    public ColumnIndex() {
        this.names = new ArrayList<>();
        this.positions = new HashMap<>();
    }

    /**
     * @throws DuplicateColumnException if a name occurs twice
     */
    public ColumnIndex(Collection<String> names) {
        this.names = new ArrayList<>(names.size());
        this.positions = new HashMap<>(names.size() * 2);
        for (String name : names) {
            insert(name);
        }
    }

    /**
     * Generated names {@code prefix1 .. prefixN}.
     */
    public static List<String> generatedNames(int count, String prefix) {
        var result = new ArrayList<String>(count);
        for (int i = 1; i <= count; i++) {
            result.add(prefix + i);
        }
        return result;
    }

    /**
     * De-duplicate names by suffixing later occurrences with {@code separator}
     * and the lowest counter that yields an unused name: {@code [a, b, a]}
     * becomes {@code [a, b, a_1]}.
     */
    public static List<String> makeUnique(List<String> names, String separator) {
        Set<String> seen = new HashSet<>(names.size() * 2);
        var result = new ArrayList<String>(names.size());
        // First occurrences keep their names even if a suffixed form comes later
        Set<String> originals = new HashSet<>(names);
        for (String name : names) {
            if (seen.add(name)) {
                result.add(name);
                continue;
            }
            int counter = 1;
            String candidate = name + separator + counter;
            while (seen.contains(candidate) || originals.contains(candidate)) {
                counter++;
                candidate = name + separator + counter;
            }
            seen.add(candidate);
            result.add(candidate);
        }
        return result;
    }

    public int size() {
        return names.size();
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    /**
     * Resolve a single key: names are looked up, integral positions are
     * bounds-checked and returned as is.
     *
     * @throws UnknownColumnException if the name is absent or the position out of range
     * @throws IllegalArgumentException if the key is neither a name nor a position
     */
    public int position(Object key) {
        if (key instanceof String name) {
            Integer position = positions.get(name);
            if (position == null) {
                throw UnknownColumnException.of(name);
            }
            return position;
        }
        if (isPosition(key)) {
            long position = ((Number) key).longValue();
            if (position < 0 || position >= names.size()) {
                throw UnknownColumnException.of(key);
            }
            return (int) position;
        }
        throw new IllegalArgumentException("Not a column key: " + key);
    }

    /**
     * Resolve a sequence of names and positions, or of booleans forming a mask.
     *
     * @throws LengthMismatchException if a boolean sequence does not cover every column
     */
    public int[] positions(List<?> keys) {
        if (!keys.isEmpty() && keys.get(0) instanceof Boolean) {
            var mask = new boolean[keys.size()];
            for (int i = 0; i < mask.length; i++) {
                Object key = keys.get(i);
                if (!(key instanceof Boolean flag)) {
                    throw new IllegalArgumentException("Mixed boolean and non-boolean column keys");
                }
                mask[i] = flag;
            }
            return positions(mask);
        }
        var result = new int[keys.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = position(keys.get(i));
        }
        return result;
    }

    /**
     * Ascending positions whose mask entry is {@code true}.
     */
    public int[] positions(boolean[] mask) {
        if (mask.length != names.size()) {
            throw LengthMismatchException.of("column mask", names.size(), mask.length);
        }
        int count = 0;
        for (boolean flag : mask) {
            if (flag) {
                count++;
            }
        }
        var result = new int[count];
        int next = 0;
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) {
                result[next++] = i;
            }
        }
        return result;
    }

    public boolean contains(Object key) {
        if (key instanceof String name) {
            return positions.containsKey(name);
        }
        if (isPosition(key)) {
            long position = ((Number) key).longValue();
            return position >= 0 && position < names.size();
        }
        return false;
    }

    public String name(int position) {
        if (position < 0 || position >= names.size()) {
            throw UnknownColumnException.of(position);
        }
        return names.get(position);
    }

    public List<String> names() {
        return Collections.unmodifiableList(names);
    }

    /**
     * Append a name at the end.
     */
    public void insert(String name) {
        insert(names.size(), name);
    }

    /**
     * Insert a name at {@code position}, shifting later names right.
     */
    public void insert(int position, String name) {
        if (name == null) {
            throw new IllegalArgumentException("name required");
        }
        if (position < 0 || position > names.size()) {
            throw new IndexOutOfBoundsException("insert position out of range: " + position);
        }
        if (positions.containsKey(name)) {
            throw DuplicateColumnException.of(name);
        }
        names.add(position, name);
        renumberFrom(position);
    }

    public void rename(String from, String to) {
        if (to == null) {
            throw new IllegalArgumentException("new name required");
        }
        int position = position(from);
        if (from.equals(to)) {
            return;
        }
        if (positions.containsKey(to)) {
            throw DuplicateColumnException.of(to);
        }
        positions.remove(from);
        positions.put(to, position);
        names.set(position, to);
    }

    /**
     * Rename several columns at once. Names may be swapped within one call.
     */
    public void rename(Map<String, String> renames) {
        var updated = new ArrayList<>(names);
        for (var entry : new LinkedHashMap<>(renames).entrySet()) {
            updated.set(position(entry.getKey()), entry.getValue());
        }
        setNames(updated);
    }

    /**
     * Replace every name at once.
     */
    public void setNames(List<String> newNames) {
        if (newNames.size() != names.size()) {
            throw LengthMismatchException.of("column names", names.size(), newNames.size());
        }
        var replacement = new ColumnIndex(newNames);
        names.clear();
        names.addAll(replacement.names);
        positions.clear();
        positions.putAll(replacement.positions);
    }

    /**
     * Remove the name at {@code position} and renumber later names.
     */
    public void delete(int position) {
        String name = name(position);
        names.remove(position);
        positions.remove(name);
        renumberFrom(position);
    }

    /**
     * First generated name that is not already taken, starting at
     * {@code prefix + (size() + 1)}.
     */
    public String nextGeneratedName(String prefix) {
        int counter = names.size() + 1;
        String candidate = prefix + counter;
        while (positions.containsKey(candidate)) {
            counter++;
            candidate = prefix + counter;
        }
        return candidate;
    }

    /**
     * Index over a subset of positions, in the given order.
     */
    public ColumnIndex select(int[] selected) {
        var selectedNames = new ArrayList<String>(selected.length);
        for (int position : selected) {
            selectedNames.add(name(position));
        }
        return new ColumnIndex(selectedNames);
    }

    public ColumnIndex copy() {
        return new ColumnIndex(names);
    }

    private void renumberFrom(int position) {
        for (int i = position; i < names.size(); i++) {
            positions.put(names.get(i), i);
        }
    }

    static boolean isPosition(Object key) {
        return key instanceof Integer || key instanceof Long
                || key instanceof Short || key instanceof Byte;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ColumnIndex other && names.equals(other.names);
    }

    @Override
    public int hashCode() {
        return names.hashCode();
    }

    @Override
    public String toString() {
        return "ColumnIndex" + names;
    }
}
