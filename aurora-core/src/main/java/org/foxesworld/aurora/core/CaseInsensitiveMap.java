package org.foxesworld.aurora.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Insertion-ordered map with case-insensitive string keys.
 * <p>
 * The first spelling of a key is kept for display; a later {@code put} with a
 * different case replaces the value but not the spelling.
 */
public final class CaseInsensitiveMap<V> {

    private final LinkedHashMap<FoldedName, V> map = new LinkedHashMap<>();

    public V get(String key) {
        if (key == null) return null;
        return map.get(FoldedName.of(key));
    }

    public V getOrDefault(String key, V fallback) {
        V v = get(key);
        return v != null ? v : fallback;
    }

    public V put(String key, V value) {
        FoldedName k = FoldedName.of(key);
        if (map.containsKey(k)) {
            return map.replace(k, value);
        }
        return map.put(k, value);
    }

    public V computeIfAbsent(String key, Function<String, V> factory) {
        V v = get(key);
        if (v == null) {
            v = factory.apply(key);
            if (v != null) put(key, v);
        }
        return v;
    }

    public boolean containsKey(String key) {
        return key != null && map.containsKey(FoldedName.of(key));
    }

    public V remove(String key) {
        if (key == null) return null;
        return map.remove(FoldedName.of(key));
    }

    public void clear() { map.clear(); }

    public int size() { return map.size(); }

    public boolean isEmpty() { return map.isEmpty(); }

    /** Keys in insertion order, original spelling. */
    public List<String> keys() {
        List<String> out = new ArrayList<>(map.size());
        for (FoldedName k : map.keySet()) out.add(k.original());
        return out;
    }

    public Collection<V> values() {
        return Collections.unmodifiableCollection(map.values());
    }

    public List<Map.Entry<String, V>> entries() {
        List<Map.Entry<String, V>> out = new ArrayList<>(map.size());
        for (Map.Entry<FoldedName, V> e : map.entrySet()) {
            out.add(Map.entry(e.getKey().original(), e.getValue()));
        }
        return out;
    }

    @Override
    public String toString() {
        return map.toString();
    }
}
