package org.foxesworld.aurora.engine.archive;

import org.foxesworld.aurora.core.ResourceType;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Writes small KEY/BIF/ERF/RIM files for tests. */
public final class ArchiveFixtures {
    private ArchiveFixtures() {}

    public record Member(String name, ResourceType type, byte[] data) {
        public static Member of(String name, ResourceType type, String text) {
            return new Member(name, type, text.getBytes(StandardCharsets.US_ASCII));
        }
    }

    /** A blob listed in a key file; {@code filename} is relative to the installation root. */
    public record Bif(String filename, List<Member> members) {}

    public static Path erf(Path file, List<Member> members) throws IOException {
        return erf(file, "ERF ", members);
    }

    public static Path mod(Path file, List<Member> members) throws IOException {
        return erf(file, "MOD ", members);
    }

    public static Path erf(Path file, String signature, List<Member> members) throws IOException {
        int n = members.size();
        int keysOffset = 32;
        int resourcesOffset = keysOffset + n * 24;
        int dataOffset = resourcesOffset + n * 8;

        Le out = new Le();
        out.ascii(signature, 4).ascii("V1.0", 4);
        out.u32(0).u32(0).u32(n).u32(0).u32(keysOffset).u32(resourcesOffset);
        for (int i = 0; i < n; i++) {
            Member m = members.get(i);
            out.ascii(m.name(), 16).u32(i).u16(m.type().id()).u16(0);
        }
        int offset = dataOffset;
        for (Member m : members) {
            out.u32(offset).u32(m.data().length);
            offset += m.data().length;
        }
        for (Member m : members) out.bytes(m.data());
        return write(file, out);
    }

    public static Path rim(Path file, List<Member> members) throws IOException {
        int n = members.size();
        int entriesOffset = 20;
        int dataOffset = entriesOffset + n * 32;

        Le out = new Le();
        out.ascii("RIM ", 4).ascii("V1.0", 4).u32(0).u32(n).u32(entriesOffset);
        int offset = dataOffset;
        for (int i = 0; i < n; i++) {
            Member m = members.get(i);
            out.ascii(m.name(), 16).u32(m.type().id()).u32(i).u32(offset).u32(m.data().length);
            offset += m.data().length;
        }
        for (Member m : members) out.bytes(m.data());
        return write(file, out);
    }

    /** Writes {@code chitin.key} under {@code root} plus every blob it lists. */
    public static Path chitin(Path root, List<Bif> bifs) throws IOException {
        for (int b = 0; b < bifs.size(); b++) {
            bif(root.resolve(bifs.get(b).filename()), b, bifs.get(b).members());
        }

        int bifCount = bifs.size();
        int keyCount = 0;
        for (Bif b : bifs) keyCount += b.members().size();

        int fileTableOffset = 64;
        int namesOffset = fileTableOffset + bifCount * 12;
        byte[][] names = new byte[bifCount][];
        int keyTableOffset = namesOffset;
        for (int b = 0; b < bifCount; b++) {
            names[b] = (bifs.get(b).filename().replace('/', '\\') + "\0").getBytes(StandardCharsets.US_ASCII);
            keyTableOffset += names[b].length;
        }

        Le out = new Le();
        out.ascii("KEY ", 4).ascii("V1  ", 4);
        out.u32(bifCount).u32(keyCount).u32(fileTableOffset).u32(keyTableOffset).u32(103).u32(42);
        out.bytes(new byte[32]);

        int nameOffset = namesOffset;
        for (int b = 0; b < bifCount; b++) {
            long size = Files.size(root.resolve(bifs.get(b).filename()));
            out.u32(size).u32(nameOffset).u16(names[b].length).u16(1);
            nameOffset += names[b].length;
        }
        for (byte[] name : names) out.bytes(name);

        for (int b = 0; b < bifCount; b++) {
            List<Member> members = bifs.get(b).members();
            for (int i = 0; i < members.size(); i++) {
                Member m = members.get(i);
                out.ascii(m.name(), 16).u16(m.type().id()).u32(((long) b << 20) | i);
            }
        }
        return write(root.resolve(Chitin.KEY_FILENAME), out);
    }

    public static Path bif(Path file, int bifIndex, List<Member> members) throws IOException {
        int n = members.size();
        int tableOffset = 20;
        int dataOffset = tableOffset + n * 16;

        Le out = new Le();
        out.ascii("BIFF", 4).ascii("V1  ", 4).u32(n).u32(0).u32(tableOffset);
        int offset = dataOffset;
        for (int i = 0; i < n; i++) {
            Member m = members.get(i);
            out.u32(((long) bifIndex << 20) | i).u32(offset).u32(m.data().length).u32(m.type().id());
            offset += m.data().length;
        }
        for (Member m : members) out.bytes(m.data());
        return write(file, out);
    }

    public static Path file(Path file, String text) throws IOException {
        Files.createDirectories(file.getParent());
        return Files.write(file, text.getBytes(StandardCharsets.US_ASCII));
    }

    private static Path write(Path file, Le out) throws IOException {
        Files.createDirectories(file.getParent());
        return Files.write(file, out.toByteArray());
    }

    /** Little-endian byte sink. */
    static final class Le {
        private final ByteArrayOutputStream buf = new ByteArrayOutputStream();

        Le u16(int v) {
            buf.write(v & 0xFF);
            buf.write((v >>> 8) & 0xFF);
            return this;
        }

        Le u32(long v) {
            byte[] b = ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt((int) v).array();
            buf.write(b, 0, 4);
            return this;
        }

        Le ascii(String s, int width) {
            byte[] raw = s.getBytes(StandardCharsets.US_ASCII);
            byte[] field = new byte[width];
            System.arraycopy(raw, 0, field, 0, Math.min(raw.length, width));
            buf.write(field, 0, width);
            return this;
        }

        Le bytes(byte[] b) {
            buf.write(b, 0, b.length);
            return this;
        }

        byte[] toByteArray() {
            return buf.toByteArray();
        }
    }
}
