package org.foxesworld.aurora.core;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where one copy of a resource lives: the backing file plus a byte range.
 * <p>
 * {@code source} names the search category that found it. Equality only
 * considers the path and the byte range.
 */
public record LocationResult(Path path, long offset, long size, FileResource resource, String source) {

    public LocationResult {
        Objects.requireNonNull(path, "path");
        if (offset < 0 || size < 0) {
            throw new IllegalArgumentException("negative range: offset=" + offset + " size=" + size);
        }
    }

    public LocationResult withSource(String newSource) {
        return new LocationResult(path, offset, size, resource, newSource);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LocationResult that)) return false;
        return offset == that.offset && size == that.size && path.equals(that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, offset, size);
    }

    @Override
    public String toString() {
        return "LocationResult{" + path + " @" + offset + "+" + size
                + (source == null ? "" : " [" + source + "]") + '}';
    }
}
