package org.foxesworld.aurora.engine.archive;

import org.foxesworld.aurora.core.ResourceType;
import org.foxesworld.aurora.core.io.ArchiveFormatException;
import org.foxesworld.aurora.core.io.BinaryReader;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The two on-disk member table layouts a capsule can have.
 * Both start with a 4-byte signature and a 4-byte version.
 */
public enum CapsuleLayout {

    /**
     * <pre>
     *   sig, "V1.0", u32 languageCount, u32 localizedSize, u32 entryCount,
     *   u32 localizedOffset, u32 keysOffset, u32 resourcesOffset
     *   key (24 bytes): char[16] resref, u32 resid, u16 type, u16 unused
     *   resource (8 bytes): u32 offset, u32 size
     * </pre>
     */
    ERF(Set.of("ERF ", "MOD ", "SAV ", "HAK ")) {
        @Override
        List<Entry> readEntries(BinaryReader in) throws IOException {
            in.skip(8);
            long count = in.readUInt32();
            in.skip(4);
            long keysOffset = in.readUInt32();
            long resourcesOffset = in.readUInt32();

            checkTable(in, keysOffset, count, 24);
            checkTable(in, resourcesOffset, count, 8);

            String[] names = new String[(int) count];
            int[] types = new int[(int) count];
            in.seek(keysOffset);
            for (int i = 0; i < count; i++) {
                names[i] = in.readString(16);
                in.readUInt32();
                types[i] = in.readUInt16();
                in.skip(2);
            }

            List<Entry> out = new ArrayList<>((int) count);
            in.seek(resourcesOffset);
            for (int i = 0; i < count; i++) {
                long offset = in.readUInt32();
                long size = in.readUInt32();
                out.add(new Entry(names[i], types[i], offset, size));
            }
            return out;
        }
    },

    /**
     * <pre>
     *   "RIM ", "V1.0", u32 reserved, u32 entryCount, u32 entriesOffset
     *   entry (32 bytes): char[16] resref, u32 type, u32 resid, u32 offset, u32 size
     * </pre>
     */
    RIM(Set.of("RIM ")) {
        @Override
        List<Entry> readEntries(BinaryReader in) throws IOException {
            in.skip(4);
            long count = in.readUInt32();
            long entriesOffset = in.readUInt32();

            checkTable(in, entriesOffset, count, 32);

            List<Entry> out = new ArrayList<>((int) count);
            in.seek(entriesOffset);
            for (int i = 0; i < count; i++) {
                String name = in.readString(16);
                long type = in.readUInt32();
                in.readUInt32();
                long offset = in.readUInt32();
                long size = in.readUInt32();
                out.add(new Entry(name, (int) type, offset, size));
            }
            return out;
        }
    };

    public static final String VERSION = "V1.0";

    private final Set<String> signatures;

    CapsuleLayout(Set<String> signatures) {
        this.signatures = signatures;
    }

    public Set<String> signatures() { return signatures; }

    public static Optional<CapsuleLayout> forSignature(String signature) {
        for (CapsuleLayout l : values()) {
            if (l.signatures.contains(signature)) return Optional.of(l);
        }
        return Optional.empty();
    }

    /** Reads the member table; the reader is positioned just past signature and version. */
    abstract List<Entry> readEntries(BinaryReader in) throws IOException;

    /** Raw member table row. */
    record Entry(String resref, int rawType, long offset, long size) {
        ResourceType type() {
            return ResourceType.fromId(rawType);
        }
    }

    private static void checkTable(BinaryReader in, long offset, long count, int entrySize) throws IOException {
        if (count > Integer.MAX_VALUE || offset + count * entrySize > in.size()) {
            throw new ArchiveFormatException("Member table (" + count + " x " + entrySize + " at " + offset
                    + ") exceeds capsule size " + in.size() + ": " + in.source());
        }
    }
}
