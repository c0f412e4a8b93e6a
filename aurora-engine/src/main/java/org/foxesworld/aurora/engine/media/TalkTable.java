package org.foxesworld.aurora.engine.media;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * String table keyed by string reference. Parsing the table file is left to the caller.
 */
@FunctionalInterface
public interface TalkTable {

    TalkTable EMPTY = ref -> Optional.empty();

    Optional<String> text(int stringRef);

    /** Texts for every ref the table knows; unknown refs are absent from the result. */
    default Map<Integer, String> batch(Collection<Integer> stringRefs) {
        Map<Integer, String> out = new LinkedHashMap<>();
        for (Integer ref : stringRefs) {
            if (ref == null || out.containsKey(ref)) continue;
            text(ref).ifPresent(t -> out.put(ref, t));
        }
        return out;
    }

    static TalkTable of(Map<Integer, String> entries) {
        Map<Integer, String> copy = Map.copyOf(entries);
        return ref -> Optional.ofNullable(copy.get(ref));
    }
}
