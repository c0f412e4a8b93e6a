package org.foxesworld.aurora.core;

import java.nio.file.Path;
import java.util.Objects;

/** Bytes of a located resource together with where they came from. */
public record ResourceResult(String name, ResourceType type, Path path, byte[] data, FileResource resource) {

    public ResourceResult {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(data, "data");
    }

    public ResourceIdentifier identifier() {
        return new ResourceIdentifier(name, type);
    }

    @Override
    public String toString() {
        return "ResourceResult{" + name + "." + type.extension() + ", " + data.length + " bytes, " + path + '}';
    }
}
