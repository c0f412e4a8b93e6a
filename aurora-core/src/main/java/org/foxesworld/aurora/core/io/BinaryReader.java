package org.foxesworld.aurora.core.io;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.FileChannel;
import java.nio.channels.NonWritableChannelException;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Little-endian random-access reader over a seekable channel.
 * <p>
 * Every read is checked against the channel size and fails with
 * {@link EOFException} instead of returning short data.
 */
public final class BinaryReader implements Closeable {

    private final SeekableByteChannel ch;
    private final String source;
    private final ByteBuffer scratch = ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN);

    public BinaryReader(SeekableByteChannel ch, String source) {
        this.ch = Objects.requireNonNull(ch, "channel");
        this.source = source == null ? "<channel>" : source;
    }

    public static BinaryReader open(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        return new BinaryReader(FileChannel.open(path, StandardOpenOption.READ), path.toString());
    }

    public static BinaryReader of(byte[] data) {
        return new BinaryReader(new ByteArrayChannel(data), "<" + data.length + " bytes>");
    }

    public String source() { return source; }

    /** Underlying channel, for callers that read ranges directly. */
    public SeekableByteChannel channel() { return ch; }

    public long position() throws IOException { return ch.position(); }

    public long size() throws IOException { return ch.size(); }

    public long remaining() throws IOException { return ch.size() - ch.position(); }

    public BinaryReader seek(long pos) throws IOException {
        if (pos < 0 || pos > ch.size()) {
            throw new EOFException("Seek to " + pos + " outside " + source + " (" + ch.size() + " bytes)");
        }
        ch.position(pos);
        return this;
    }

    public BinaryReader skip(long n) throws IOException {
        return seek(ch.position() + n);
    }

    public int readUInt8() throws IOException {
        fill(1);
        return scratch.get() & 0xFF;
    }

    public int readUInt16() throws IOException {
        fill(2);
        return scratch.getShort() & 0xFFFF;
    }

    public long readUInt32() throws IOException {
        fill(4);
        return scratch.getInt() & 0xFFFFFFFFL;
    }

    public int readInt32() throws IOException {
        fill(4);
        return scratch.getInt();
    }

    public byte[] readBytes(int n) throws IOException {
        if (n < 0) throw new IllegalArgumentException("n < 0: " + n);
        require(n);
        ByteBuffer buf = ByteBuffer.allocate(n);
        readFully(buf);
        return buf.array();
    }

    /** Fixed-width ASCII field; content after the first NUL is dropped. */
    public String readString(int n) throws IOException {
        byte[] raw = readBytes(n);
        int end = 0;
        while (end < raw.length && raw[end] != 0) end++;
        return new String(raw, 0, end, StandardCharsets.US_ASCII);
    }

    private void fill(int n) throws IOException {
        require(n);
        scratch.clear().limit(n);
        readFully(scratch);
        scratch.flip();
    }

    private void require(long n) throws IOException {
        long pos = ch.position();
        if (pos + n > ch.size()) {
            throw new EOFException("Read of " + n + " bytes at " + pos + " past end of " + source + " (" + ch.size() + " bytes)");
        }
    }

    private void readFully(ByteBuffer buf) throws IOException {
        while (buf.hasRemaining()) {
            if (ch.read(buf) < 0) throw new EOFException("Unexpected end of " + source);
        }
    }

    @Override
    public void close() throws IOException {
        ch.close();
    }

    /** Read-only seekable view over an in-memory array. */
    static final class ByteArrayChannel implements SeekableByteChannel {
        private final byte[] data;
        private int pos;
        private boolean open = true;

        ByteArrayChannel(byte[] data) {
            this.data = Objects.requireNonNull(data, "data");
        }

        @Override
        public int read(ByteBuffer dst) throws IOException {
            ensureOpen();
            if (pos >= data.length) return -1;
            int n = Math.min(dst.remaining(), data.length - pos);
            dst.put(data, pos, n);
            pos += n;
            return n;
        }

        @Override
        public int write(ByteBuffer src) {
            throw new NonWritableChannelException();
        }

        @Override
        public long position() throws IOException {
            ensureOpen();
            return pos;
        }

        @Override
        public SeekableByteChannel position(long newPosition) throws IOException {
            ensureOpen();
            if (newPosition < 0) throw new IllegalArgumentException("position < 0");
            pos = (int) Math.min(newPosition, data.length);
            return this;
        }

        @Override
        public long size() throws IOException {
            ensureOpen();
            return data.length;
        }

        @Override
        public SeekableByteChannel truncate(long size) {
            throw new NonWritableChannelException();
        }

        @Override
        public boolean isOpen() { return open; }

        @Override
        public void close() { open = false; }

        private void ensureOpen() throws IOException {
            if (!open) throw new ClosedChannelException();
        }
    }
}
