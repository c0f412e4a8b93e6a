package org.foxesworld.aurora.core.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Base for archive structure readers: one {@link #parse(BinaryReader)} to
 * implement, with byte array, stream, file and path entry points on top.
 * <p>
 * - Null inputs are rejected up front.
 * - A failure is logged with its source and rethrown unchanged.
 * - Structural problems surface as {@link ArchiveFormatException}.
 */
public abstract class ByteParser<T> {
    private static final Logger logger = LoggerFactory.getLogger(ByteParser.class);

    /**
     * @param in little-endian reader positioned at offset 0
     * @return the parsed structure
     * @throws IOException on truncation or structural error
     */
    protected abstract T parse(BinaryReader in) throws IOException;

    public T parse(byte[] data) throws IOException {
        Objects.requireNonNull(data, "data");
        try (BinaryReader in = BinaryReader.of(data)) {
            return parse(in);
        } catch (IOException | RuntimeException ex) {
            logger.error("Cannot parse in-memory buffer ({} bytes): {}", data.length, ex.getMessage(), ex);
            throw ex;
        }
    }

    /** Reads the stream fully, then parses. The stream is closed. */
    public T parse(InputStream input) throws IOException {
        Objects.requireNonNull(input, "input");
        byte[] data;
        try (InputStream in = input) {
            data = in.readAllBytes();
        }
        return parse(data);
    }

    public T parse(File file) throws IOException {
        Objects.requireNonNull(file, "file");
        return parse(file.toPath());
    }

    /**
     * Parses through a seekable channel; the file is never loaded whole.
     *
     * @throws FileNotFoundException when {@code path} does not exist
     */
    public T parse(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        if (!Files.exists(path)) {
            logger.error("No such file: {}", path);
            throw new FileNotFoundException("No such file: " + path);
        }
        if (!Files.isReadable(path)) {
            logger.error("File not readable: {}", path);
            throw new IOException("File not readable: " + path);
        }
        try (BinaryReader in = BinaryReader.open(path)) {
            return parse(in);
        } catch (IOException | RuntimeException ex) {
            logger.error("Cannot parse {}: {}", path, ex.getMessage(), ex);
            throw ex;
        }
    }
}
