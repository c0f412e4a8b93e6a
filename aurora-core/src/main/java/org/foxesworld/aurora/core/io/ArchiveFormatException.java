package org.foxesworld.aurora.core.io;

import java.io.IOException;

/** Structurally invalid archive or key file. */
public class ArchiveFormatException extends IOException {

    public ArchiveFormatException(String message) {
        super(message);
    }

    public ArchiveFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
