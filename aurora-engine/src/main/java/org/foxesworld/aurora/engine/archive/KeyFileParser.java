package org.foxesworld.aurora.engine.archive;

// Author: Calista Verner

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.aurora.core.ResourceType;
import org.foxesworld.aurora.core.io.ArchiveFormatException;
import org.foxesworld.aurora.core.io.BinaryReader;
import org.foxesworld.aurora.core.io.ByteParser;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code chitin.key}.
 * <pre>
 * header (64 bytes):
 *   "KEY " "V1  "|"V1.1"
 *   u32 bifCount, u32 keyCount, u32 fileTableOffset, u32 keyTableOffset
 *   u32 buildYear, u32 buildDay, 32 reserved
 * file table, 12 bytes each:
 *   u32 fileSize, u32 filenameOffset, u16 filenameLength, u16 drives
 * key table, 22 bytes each:
 *   char[16] resref, u16 type, u32 resourceId
 * </pre>
 */
public final class KeyFileParser extends ByteParser<KeyFile> {

    private static final Logger log = LogManager.getLogger(KeyFileParser.class);

    static final int FILE_ENTRY_SIZE = 12;
    static final int KEY_ENTRY_SIZE = 22;

    @Override
    protected KeyFile parse(BinaryReader in) throws IOException {
        String magic = in.readString(4);
        String version = in.readString(4);
        if (!"KEY ".equals(magic)) {
            throw new ArchiveFormatException("Not a key file (magic '" + magic + "'): " + in.source());
        }
        if (!"V1  ".equals(version) && !"V1.1".equals(version)) {
            throw new ArchiveFormatException("Unsupported key file version '" + version + "': " + in.source());
        }

        long bifCount = in.readUInt32();
        long keyCount = in.readUInt32();
        long fileTableOffset = in.readUInt32();
        long keyTableOffset = in.readUInt32();
        long buildYear = in.readUInt32();
        long buildDay = in.readUInt32();

        long size = in.size();
        checkTable(in, "file table", fileTableOffset, bifCount, FILE_ENTRY_SIZE, size);
        checkTable(in, "key table", keyTableOffset, keyCount, KEY_ENTRY_SIZE, size);

        long[] fileSizes = new long[(int) bifCount];
        long[] nameOffsets = new long[(int) bifCount];
        int[] nameLengths = new int[(int) bifCount];
        int[] drives = new int[(int) bifCount];

        in.seek(fileTableOffset);
        for (int i = 0; i < bifCount; i++) {
            fileSizes[i] = in.readUInt32();
            nameOffsets[i] = in.readUInt32();
            nameLengths[i] = in.readUInt16();
            drives[i] = in.readUInt16();
        }

        List<KeyFile.BifEntry> bifs = new ArrayList<>((int) bifCount);
        for (int i = 0; i < bifCount; i++) {
            if (nameOffsets[i] + nameLengths[i] > size) {
                throw new ArchiveFormatException("Blob filename #" + i + " outside key file: " + in.source());
            }
            in.seek(nameOffsets[i]);
            String filename = in.readString(nameLengths[i]).replace('\\', '/');
            bifs.add(new KeyFile.BifEntry(fileSizes[i], filename, drives[i]));
        }

        List<KeyFile.KeyEntry> keys = new ArrayList<>((int) keyCount);
        in.seek(keyTableOffset);
        for (int i = 0; i < keyCount; i++) {
            String resref = in.readString(16);
            int rawType = in.readUInt16();
            long resId = in.readUInt32();
            keys.add(new KeyFile.KeyEntry(resref, ResourceType.fromId(rawType), rawType, resId));
        }

        log.debug("[chitin] key {} {}: {} blobs, {} keys", in.source(), version.trim(), bifCount, keyCount);
        return new KeyFile(version, buildYear, buildDay, bifs, keys);
    }

    private static void checkTable(BinaryReader in, String what, long offset, long count, int entrySize, long size)
            throws ArchiveFormatException {
        if (count > Integer.MAX_VALUE || offset + count * entrySize > size) {
            throw new ArchiveFormatException(what + " (" + count + " x " + entrySize + " at " + offset
                    + ") exceeds key file size " + size + ": " + in.source());
        }
    }
}
