package org.foxesworld.aurora.engine.archive;

// Author: Calista Verner

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.aurora.core.FileResource;
import org.foxesworld.aurora.core.ResourceType;
import org.foxesworld.aurora.core.io.ArchiveFormatException;
import org.foxesworld.aurora.core.io.BinaryReader;
import org.foxesworld.aurora.core.io.PathNorm;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Archive index of an installation: {@code chitin.key} plus the blobs it lists.
 * <p>
 * Blob header:
 * <pre>
 *   "BIFF" "V1  " u32 varCount, u32 fixedCount, u32 varTableOffset
 *   var entry (16 bytes): u32 id, u32 offset, u32 size, u32 type
 * </pre>
 * Member names come from the key table, matched on {@code (bifIndex << 20) | (id & 0xFFFFF)}.
 * A blob that cannot be read is logged and excluded; an unreadable key file is fatal.
 */
public final class Chitin implements Iterable<FileResource> {

    private static final Logger log = LogManager.getLogger(Chitin.class);

    public static final String KEY_FILENAME = "chitin.key";

    static final int VAR_ENTRY_SIZE = 16;

    private final Path keyPath;
    private final KeyFile keyFile;
    private final List<Path> bifPaths;
    private final List<FileResource> resources;

    private Chitin(Path keyPath, KeyFile keyFile, List<Path> bifPaths, List<FileResource> resources) {
        this.keyPath = keyPath;
        this.keyFile = keyFile;
        this.bifPaths = Collections.unmodifiableList(bifPaths);
        this.resources = Collections.unmodifiableList(resources);
    }

    /**
     * Loads {@code chitin.key} from {@code root} (case-aware) and every blob it lists.
     *
     * @throws IOException when the key file is missing or invalid
     */
    public static Chitin load(Path root) throws IOException {
        Objects.requireNonNull(root, "root");
        Path keyPath = PathNorm.resolveCaseAware(root, KEY_FILENAME);
        return load(root, keyPath);
    }

    public static Chitin load(Path root, Path keyPath) throws IOException {
        KeyFile key = new KeyFileParser().parse(keyPath);

        Map<Long, KeyFile.KeyEntry> byId = new HashMap<>(key.keys().size() * 2);
        for (KeyFile.KeyEntry k : key.keys()) {
            byId.putIfAbsent(k.resourceId(), k);
        }

        List<Path> bifPaths = new ArrayList<>(key.bifs().size());
        List<FileResource> out = new ArrayList<>(key.keys().size());

        for (int i = 0; i < key.bifs().size(); i++) {
            KeyFile.BifEntry bif = key.bifs().get(i);
            Path bifPath = PathNorm.resolveCaseAware(root, bif.filename());
            bifPaths.add(bifPath);

            if (!Files.isRegularFile(bifPath)) {
                log.warn("[chitin] blob #{} '{}' not found, skipped", i, bif.filename());
                continue;
            }
            try {
                int before = out.size();
                readBif(bifPath, i, byId, out);
                log.debug("[chitin] {} -> {} resources", bif.filename(), out.size() - before);
            } catch (IOException | RuntimeException e) {
                log.warn("[chitin] blob '{}' unreadable, skipped: {}", bifPath, e.getMessage(), e);
            }
        }

        log.info("[chitin] loaded {} resources from {} blobs", out.size(), key.bifs().size());
        return new Chitin(keyPath, key, bifPaths, out);
    }

    private static void readBif(Path bifPath, int bifIndex, Map<Long, KeyFile.KeyEntry> byId, List<FileResource> out)
            throws IOException {
        List<FileResource> local = new ArrayList<>();
        try (BinaryReader in = BinaryReader.open(bifPath)) {
            String magic = in.readString(4);
            String version = in.readString(4);
            if ("BZF ".equals(magic)) {
                log.warn("[chitin] compressed blob {} is not addressable by offset, skipped", bifPath);
                return;
            }
            if (!"BIFF".equals(magic)) {
                throw new ArchiveFormatException("Not a blob (magic '" + magic + "'): " + bifPath);
            }
            if (!"V1  ".equals(version)) {
                throw new ArchiveFormatException("Unsupported blob version '" + version + "': " + bifPath);
            }

            long varCount = in.readUInt32();
            in.readUInt32(); // fixed resources, unused by either title
            long varTableOffset = in.readUInt32();

            long fileSize = in.size();
            if (varTableOffset + varCount * VAR_ENTRY_SIZE > fileSize) {
                throw new ArchiveFormatException("Resource table exceeds blob size: " + bifPath);
            }

            in.seek(varTableOffset);
            for (long n = 0; n < varCount; n++) {
                long id = in.readUInt32();
                long offset = in.readUInt32();
                long size = in.readUInt32();
                long rawType = in.readUInt32();

                long keyId = ((long) bifIndex << 20) | (id & 0xFFFFF);
                KeyFile.KeyEntry key = byId.get(keyId);
                if (key == null) {
                    log.debug("[chitin] {} entry {} has no key, skipped", bifPath.getFileName(), id & 0xFFFFF);
                    continue;
                }
                if (offset + size > fileSize) {
                    log.warn("[chitin] {} entry '{}' range {}+{} outside blob, skipped",
                            bifPath.getFileName(), key.resref(), offset, size);
                    continue;
                }
                ResourceType type = key.type().isInvalid() ? ResourceType.fromId(rawType) : key.type();
                local.add(new FileResource(key.resref(), type, bifPath, offset, size));
            }
        }
        out.addAll(local);
    }

    public Path keyPath() { return keyPath; }

    public KeyFile keyFile() { return keyFile; }

    /** Blob paths in file-table order, whether or not they could be read. */
    public List<Path> bifPaths() { return bifPaths; }

    public List<FileResource> resources() { return resources; }

    public int size() { return resources.size(); }

    @Override
    public Iterator<FileResource> iterator() {
        return resources.iterator();
    }
}
