package org.foxesworld.aurora.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class CaseInsensitiveMapTest {

    @Test
    void lookupsIgnoreCase() {
        CaseInsensitiveMap<Integer> map = new CaseInsensitiveMap<>();
        map.put("M01AA.mod", 1);

        assertEquals(1, map.get("m01aa.MOD"));
        assertTrue(map.containsKey("m01aa.mod"));
        assertNull(map.get("m01ab.mod"));
        assertNull(map.get(null));
        assertFalse(map.containsKey(null));
    }

    @Test
    void firstSpellingIsKeptOnReplace() {
        CaseInsensitiveMap<String> map = new CaseInsensitiveMap<>();
        map.put("Patch1", "a");
        String prev = map.put("PATCH1", "b");

        assertEquals("a", prev);
        assertEquals(1, map.size());
        assertEquals(List.of("Patch1"), map.keys());
        assertEquals("b", map.get("patch1"));
    }

    @Test
    void keepsInsertionOrder() {
        CaseInsensitiveMap<Integer> map = new CaseInsensitiveMap<>();
        map.put("zeta", 1);
        map.put("Alpha", 2);
        map.put("mid", 3);

        assertEquals(List.of("zeta", "Alpha", "mid"), map.keys());
        List<Map.Entry<String, Integer>> entries = map.entries();
        assertEquals("Alpha", entries.get(1).getKey());
        assertEquals(2, entries.get(1).getValue());
    }

    @Test
    void removeAndComputeIfAbsent() {
        CaseInsensitiveMap<String> map = new CaseInsensitiveMap<>();
        assertEquals("made", map.computeIfAbsent("Key", k -> "made"));
        assertEquals("made", map.computeIfAbsent("KEY", k -> "other"));
        assertEquals("made", map.remove("key"));
        assertTrue(map.isEmpty());
        assertEquals("fallback", map.getOrDefault("key", "fallback"));
    }

    @Test
    void foldedNameEquality() {
        assertEquals(FoldedName.of("Override"), FoldedName.of("OVERRIDE"));
        assertEquals("Override", FoldedName.of("Override").original());
        assertEquals("override", FoldedName.of("Override").folded());
    }
}
