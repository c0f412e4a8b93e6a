package org.foxesworld.aurora.engine.archive;

import org.foxesworld.aurora.core.ResourceType;

import java.util.List;

/**
 * Parsed archive index: the blob file table plus the key table that names
 * the blob members.
 */
public record KeyFile(String version, long buildYear, long buildDay, List<BifEntry> bifs, List<KeyEntry> keys) {

    public KeyFile {
        bifs = List.copyOf(bifs);
        keys = List.copyOf(keys);
    }

    /** One blob listed in the file table. {@code filename} uses forward slashes. */
    public record BifEntry(long fileSize, String filename, int drives) {}

    /** One named member. The resource id packs the blob index in its top 12 bits. */
    public record KeyEntry(String resref, ResourceType type, int rawType, long resourceId) {

        public int bifIndex() {
            return (int) (resourceId >>> 20);
        }

        public int resIndex() {
            return (int) (resourceId & 0xFFFFF);
        }
    }
}
