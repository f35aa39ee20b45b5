package mwtab;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered string multimap. A key may occur more than once; {@link #get(String)} returns the first
 * value while iteration yields every pair in insertion order, tagged with its duplicate index.
 */
public class DuplicatesMap implements Iterable<DuplicatesMap.Entry> {

    private final List<String> keys = new ArrayList<>();
    private final List<String> values = new ArrayList<>();
    private final Map<String, List<Integer>> positions = new HashMap<>();

    public DuplicatesMap() {
    }

    public DuplicatesMap(DuplicatesMap other) {
        if (other != null) {
            for (int i = 0; i < other.keys.size(); i++) {
                add(other.keys.get(i), other.values.get(i));
            }
        }
    }

    public static DuplicatesMap of(String... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs");
        }
        DuplicatesMap map = new DuplicatesMap();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.add(keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    public void add(String key, String value) {
        positions.computeIfAbsent(key, k -> new ArrayList<>()).add(keys.size());
        keys.add(key);
        values.add(value);
    }

    /**
     * Replaces the first value stored under the key, or appends the pair when the key is absent.
     */
    public void set(String key, String value) {
        List<Integer> at = positions.get(key);
        if (at == null) {
            add(key, value);
        } else {
            values.set(at.get(0), value);
        }
    }

    public String get(String key) {
        List<Integer> at = positions.get(key);
        return at == null ? null : values.get(at.get(0));
    }

    public String getOrDefault(String key, String defaultValue) {
        String value = get(key);
        return value == null ? defaultValue : value;
    }

    public List<String> getAll(String key) {
        List<Integer> at = positions.get(key);
        if (at == null) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>(at.size());
        for (Integer i : at) {
            result.add(values.get(i));
        }
        return result;
    }

    public boolean containsKey(String key) {
        return positions.containsKey(key);
    }

    /**
     * Removes every occurrence of the key.
     */
    public void remove(String key) {
        if (!positions.containsKey(key)) {
            return;
        }
        List<String> oldKeys = new ArrayList<>(keys);
        List<String> oldValues = new ArrayList<>(values);
        clear();
        for (int i = 0; i < oldKeys.size(); i++) {
            if (!oldKeys.get(i).equals(key)) {
                add(oldKeys.get(i), oldValues.get(i));
            }
        }
    }

    public void clear() {
        keys.clear();
        values.clear();
        positions.clear();
    }

    public int size() {
        return keys.size();
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    /** Distinct keys in first-occurrence order. */
    public List<String> keys() {
        return new ArrayList<>(new LinkedHashSet<>(keys));
    }

    /** Every key, duplicates included, in insertion order. */
    public List<String> allKeys() {
        return Collections.unmodifiableList(keys);
    }

    public List<String> values() {
        return Collections.unmodifiableList(values);
    }

    public List<String> duplicateKeys() {
        List<String> result = new ArrayList<>();
        for (String key : keys()) {
            if (positions.get(key).size() > 1) {
                result.add(key);
            }
        }
        return result;
    }

    public List<Entry> entries() {
        List<Entry> result = new ArrayList<>(keys.size());
        Map<String, Integer> seen = new HashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            String key = keys.get(i);
            int index = seen.merge(key, 1, Integer::sum) - 1;
            result.add(new Entry(key, values.get(i), index));
        }
        return result;
    }

    /**
     * Returns a copy with the listed keys first, each with all of its occurrences, followed by the
     * remaining pairs in insertion order.
     */
    public DuplicatesMap reorder(List<String> keyOrder) {
        DuplicatesMap result = new DuplicatesMap();
        for (String key : keyOrder) {
            for (String value : getAll(key)) {
                result.add(key, value);
            }
        }
        for (int i = 0; i < keys.size(); i++) {
            if (!keyOrder.contains(keys.get(i))) {
                result.add(keys.get(i), values.get(i));
            }
        }
        return result;
    }

    @Override
    public Iterator<Entry> iterator() {
        return entries().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DuplicatesMap)) {
            return false;
        }
        DuplicatesMap that = (DuplicatesMap) o;
        return keys.equals(that.keys) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keys, values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < keys.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(keys.get(i)).append('=').append(values.get(i));
        }
        return sb.append('}').toString();
    }

    @Data
    @AllArgsConstructor
    public static class Entry {
        private final String key;
        private final String value;
        private final int duplicateIndex;
    }
}
