package org.foxesworld.aurora.core;

import java.util.Locale;
import java.util.Objects;

/**
 * Case-folded name used as a lookup key. Equality ignores case, {@link #original()}
 * keeps the spelling as it was first seen.
 */
public final class FoldedName implements Comparable<FoldedName> {

    private final String original;
    private final String folded;

    private FoldedName(String original) {
        this.original = original;
        this.folded = fold(original);
    }

    public static FoldedName of(String name) {
        return new FoldedName(Objects.requireNonNull(name, "name"));
    }

    public static String fold(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }

    public String original() { return original; }

    public String folded() { return folded; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FoldedName other)) return false;
        return folded.equals(other.folded);
    }

    @Override
    public int hashCode() {
        return folded.hashCode();
    }

    @Override
    public int compareTo(FoldedName o) {
        return folded.compareTo(o.folded);
    }

    @Override
    public String toString() {
        return original;
    }
}
