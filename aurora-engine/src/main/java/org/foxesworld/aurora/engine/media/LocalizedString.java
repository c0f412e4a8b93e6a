package org.foxesworld.aurora.engine.media;

import java.util.List;
import java.util.Optional;

/**
 * A string reference into the talk tables plus any substrings embedded
 * alongside it. A reference of {@code -1} means "no table entry".
 */
public record LocalizedString(int stringRef, List<String> substrings) {

    public static final int NO_REF = -1;

    public LocalizedString {
        substrings = substrings == null ? List.of() : List.copyOf(substrings);
    }

    public static LocalizedString ofRef(int stringRef) {
        return new LocalizedString(stringRef, List.of());
    }

    public static LocalizedString ofText(String... texts) {
        return new LocalizedString(NO_REF, List.of(texts));
    }

    public boolean hasRef() {
        return stringRef != NO_REF;
    }

    public Optional<String> firstSubstring() {
        return substrings.isEmpty() ? Optional.empty() : Optional.of(substrings.get(0));
    }
}
