package org.foxesworld.aurora.core;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Logical key of a resource: a name plus a {@link ResourceType}.
 * <p>
 * Two identifiers are equal when their types match and their names match
 * ignoring case. The spelling passed in is kept for display.
 */
public final class ResourceIdentifier {

    private final String name;
    private final ResourceType type;
    private final String folded;

    public ResourceIdentifier(String name, ResourceType type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.folded = FoldedName.fold(name);
    }

    public static ResourceIdentifier of(String name, ResourceType type) {
        return new ResourceIdentifier(name, type);
    }

    /**
     * Splits a filename at its last dot. Unknown extensions yield {@link ResourceType#INVALID}.
     */
    public static ResourceIdentifier fromPath(String filename) {
        Objects.requireNonNull(filename, "filename");
        String f = filename.replace('\\', '/');
        int slash = f.lastIndexOf('/');
        if (slash >= 0) f = f.substring(slash + 1);

        int dot = f.lastIndexOf('.');
        if (dot < 0) return new ResourceIdentifier(f, ResourceType.INVALID);
        return new ResourceIdentifier(f.substring(0, dot), ResourceType.fromExtension(f.substring(dot + 1)));
    }

    public static ResourceIdentifier fromPath(Path path) {
        Objects.requireNonNull(path, "path");
        Path fn = path.getFileName();
        return fromPath(fn == null ? path.toString() : fn.toString());
    }

    public String name() { return name; }

    public ResourceType type() { return type; }

    /** Lowercased name, the form used for comparisons. */
    public String foldedName() { return folded; }

    public String filename() {
        return type.isInvalid() ? name : name + "." + type.extension();
    }

    /** Same name, different type. */
    public ResourceIdentifier withType(ResourceType other) {
        return new ResourceIdentifier(name, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResourceIdentifier that)) return false;
        return type == that.type && folded.equals(that.folded);
    }

    @Override
    public int hashCode() {
        return 31 * folded.hashCode() + type.hashCode();
    }

    @Override
    public String toString() {
        return FoldedName.fold(filename());
    }
}
