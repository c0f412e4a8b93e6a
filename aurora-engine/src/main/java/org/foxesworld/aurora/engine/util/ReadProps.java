package org.foxesworld.aurora.engine.util;

import java.util.HashSet;
import java.util.Set;

/** System property readers with defaults. */
public class ReadProps {

    public static Set<String> readCsvProperty(String key, Set<String> defaults) {
        String raw = System.getProperty(key);
        if (raw == null || raw.isBlank()) return defaults;

        HashSet<String> out = new HashSet<>();
        for (String s : raw.split(",")) {
            String v = s.trim();
            if (!v.isEmpty()) out.add(v);
        }
        return out.isEmpty() ? defaults : Set.copyOf(out);
    }

    /** Positive int property; blank, malformed or non-positive values give {@code def}. */
    public static int readIntProperty(String key, int def) {
        String raw = System.getProperty(key);
        if (raw == null || raw.isBlank()) return def;
        try {
            int v = Integer.parseInt(raw.trim());
            return v > 0 ? v : def;
        } catch (NumberFormatException e) {
            return def;
        }
    }

}
