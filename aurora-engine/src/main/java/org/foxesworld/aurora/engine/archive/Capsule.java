package org.foxesworld.aurora.engine.archive;

// Author: Calista Verner

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.aurora.core.FileResource;
import org.foxesworld.aurora.core.ResourceIdentifier;
import org.foxesworld.aurora.core.ResourceResult;
import org.foxesworld.aurora.core.ResourceType;
import org.foxesworld.aurora.core.io.ArchiveFormatException;
import org.foxesworld.aurora.core.io.BinaryReader;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view of one container file (ERF family or RIM).
 * <p>
 * The member table is read once at {@link #open(Path)}. Member bytes are read on demand.
 * When the table names the same (name, type) twice, the first entry wins.
 */
public final class Capsule implements Iterable<FileResource> {

    private static final Logger log = LogManager.getLogger(Capsule.class);

    private final Path path;
    private final CapsuleLayout layout;
    private final String signature;
    private final LinkedHashMap<ResourceIdentifier, FileResource> members;

    private Capsule(Path path, CapsuleLayout layout, String signature, LinkedHashMap<ResourceIdentifier, FileResource> members) {
        this.path = path;
        this.layout = layout;
        this.signature = signature;
        this.members = members;
    }

    /**
     * @throws ArchiveFormatException on unknown signature, bad version or a member outside the file
     */
    public static Capsule open(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        try (BinaryReader in = BinaryReader.open(path)) {
            String signature = in.readString(4);
            String version = in.readString(4);

            CapsuleLayout layout = CapsuleLayout.forSignature(signature)
                    .orElseThrow(() -> new ArchiveFormatException("Unknown capsule signature '" + signature + "': " + path));
            if (!CapsuleLayout.VERSION.equals(version)) {
                throw new ArchiveFormatException("Unsupported capsule version '" + version + "': " + path);
            }

            long fileSize = in.size();
            LinkedHashMap<ResourceIdentifier, FileResource> members = new LinkedHashMap<>();
            for (CapsuleLayout.Entry e : layout.readEntries(in)) {
                if (e.offset() + e.size() > fileSize) {
                    throw new ArchiveFormatException("Member '" + e.resref() + "' range " + e.offset() + "+" + e.size()
                            + " outside " + path + " (" + fileSize + " bytes)");
                }
                FileResource fr = new FileResource(e.resref(), e.type(), path, e.offset(), e.size());
                FileResource prev = members.putIfAbsent(fr.identifier(), fr);
                if (prev != null) {
                    log.debug("Duplicate member {} in {}, keeping first", fr.identifier(), path.getFileName());
                }
            }
            return new Capsule(path, layout, signature, members);
        }
    }

    public Path path() { return path; }

    public CapsuleLayout layout() { return layout; }

    public String signature() { return signature; }

    public int size() { return members.size(); }

    public List<FileResource> resources() {
        return Collections.unmodifiableList(new ArrayList<>(members.values()));
    }

    @Override
    public Iterator<FileResource> iterator() {
        return Collections.unmodifiableCollection(members.values()).iterator();
    }

    public Optional<FileResource> info(String name, ResourceType type) {
        return info(new ResourceIdentifier(name, type));
    }

    public Optional<FileResource> info(ResourceIdentifier id) {
        return Optional.ofNullable(members.get(id));
    }

    public boolean contains(String name, ResourceType type) {
        return members.containsKey(new ResourceIdentifier(name, type));
    }

    public boolean contains(ResourceIdentifier id) {
        return members.containsKey(id);
    }

    /** Member bytes, or empty when the member is absent. */
    public Optional<byte[]> resource(String name, ResourceType type) throws IOException {
        Optional<FileResource> fr = info(name, type);
        if (fr.isEmpty()) return Optional.empty();
        return Optional.of(fr.get().data());
    }

    /**
     * Reads several members through a single file handle. Every query gets an
     * entry in the result, in query order.
     */
    public Map<ResourceIdentifier, Optional<ResourceResult>> batch(Collection<ResourceIdentifier> queries) throws IOException {
        Map<ResourceIdentifier, Optional<ResourceResult>> out = new LinkedHashMap<>();
        try (FileChannel ch = FileChannel.open(path, StandardOpenOption.READ)) {
            for (ResourceIdentifier q : queries) {
                FileResource fr = members.get(q);
                if (fr == null) {
                    out.put(q, Optional.empty());
                    continue;
                }
                byte[] data = fr.read(ch);
                out.put(q, Optional.of(new ResourceResult(fr.name(), fr.type(), path, data, fr)));
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return "Capsule{" + path.getFileName() + ", " + layout + ", " + members.size() + " members}";
    }
}
