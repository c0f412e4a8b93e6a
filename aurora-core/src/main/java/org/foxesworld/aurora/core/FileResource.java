package org.foxesworld.aurora.core;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Lazy descriptor of one resource: identifier, backing file and byte range.
 * <p>
 * Nothing is read until {@link #data()} is called. Descriptors compare equal
 * by identifier alone; use {@link #sameLocation(FileResource)} to compare
 * where the bytes live.
 */
public final class FileResource {

    private final ResourceIdentifier identifier;
    private final Path path;
    private final long offset;
    private final long size;

    public FileResource(ResourceIdentifier identifier, Path path, long offset, long size) {
        this.identifier = Objects.requireNonNull(identifier, "identifier");
        this.path = Objects.requireNonNull(path, "path");
        if (offset < 0) throw new IllegalArgumentException("offset < 0: " + offset);
        if (size < 0) throw new IllegalArgumentException("size < 0: " + size);
        this.offset = offset;
        this.size = size;
    }

    public FileResource(String name, ResourceType type, Path path, long offset, long size) {
        this(new ResourceIdentifier(name, type), path, offset, size);
    }

    /** Loose file: the whole file is the resource. */
    public static FileResource fromPath(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return new FileResource(ResourceIdentifier.fromPath(file), file, 0, Files.size(file));
    }

    public ResourceIdentifier identifier() { return identifier; }

    public String name() { return identifier.name(); }

    public ResourceType type() { return identifier.type(); }

    public String filename() { return identifier.filename(); }

    public Path path() { return path; }

    public long offset() { return offset; }

    public long size() { return size; }

    /** True when the descriptor covers a whole loose file rather than an archive member. */
    public boolean isLoose() {
        return offset == 0 && ResourceIdentifier.fromPath(path).equals(identifier);
    }

    /** Opens the backing file, reads exactly {@code size} bytes at {@code offset}, closes it. */
    public byte[] data() throws IOException {
        try (FileChannel ch = FileChannel.open(path, StandardOpenOption.READ)) {
            return read(ch);
        }
    }

    /**
     * Reads this range from an already open channel. The channel stays open;
     * callers batching many reads on one file share a single handle this way.
     */
    public byte[] read(SeekableByteChannel ch) throws IOException {
        if (size > Integer.MAX_VALUE - 8) {
            throw new IOException("Resource too large: " + identifier + " (" + size + " bytes)");
        }
        if (offset + size > ch.size()) {
            throw new EOFException("Range " + offset + "+" + size + " exceeds " + path + " (" + ch.size() + " bytes)");
        }
        ByteBuffer buf = ByteBuffer.allocate((int) size);
        ch.position(offset);
        while (buf.hasRemaining()) {
            if (ch.read(buf) < 0) {
                throw new EOFException("Unexpected end of " + path + " reading " + identifier);
            }
        }
        return buf.array();
    }

    public boolean sameLocation(FileResource other) {
        return other != null && offset == other.offset && size == other.size && path.equals(other.path);
    }

    public LocationResult location(String source) {
        return new LocationResult(path, offset, size, this, source);
    }

    public LocationResult location() {
        return location(null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileResource that)) return false;
        return identifier.equals(that.identifier);
    }

    @Override
    public int hashCode() {
        return identifier.hashCode();
    }

    @Override
    public String toString() {
        return "FileResource{" + identifier + " in " + path + " @" + offset + "+" + size + '}';
    }
}
