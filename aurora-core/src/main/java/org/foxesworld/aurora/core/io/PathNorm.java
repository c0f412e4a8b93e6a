package org.foxesworld.aurora.core.io;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Slash normalization and case-aware path resolution.
 * <p>
 * Game data is authored on case-insensitive filesystems, so a key file may say
 * {@code data\Models.bif} while the disk holds {@code Data/models.bif}.
 */
public final class PathNorm {
    private PathNorm() {}

    public static String normalize(String relative) {
        if (relative == null) return "";
        String id = relative.trim().replace('\\', '/');

        while (id.startsWith("./")) id = id.substring(2);
        while (id.startsWith("/")) id = id.substring(1);

        id = id.replaceAll("/{2,}", "/");
        if (id.endsWith("/")) id = id.substring(0, id.length() - 1);

        return id;
    }

    /** Join path segments and normalize slashes. */
    public static String join(String a, String b) {
        String aa = (a == null) ? "" : a.replace('\\', '/');
        String bb = (b == null) ? "" : b.replace('\\', '/');

        if (aa.endsWith("/")) aa = aa.substring(0, aa.length() - 1);
        while (bb.startsWith("/")) bb = bb.substring(1);

        String out = aa.isEmpty() ? bb : (aa + "/" + bb);
        return out.replaceAll("/{2,}", "/");
    }

    /** POSIX-style relative path of {@code child} under {@code root}; "." for the root itself. */
    public static String relativize(Path root, Path child) {
        String rel = root.relativize(child).toString().replace('\\', '/');
        return rel.isEmpty() ? "." : rel;
    }

    /**
     * Resolves {@code relative} segment by segment under {@code root}. Each segment
     * first tries an exact match, then a case-insensitive scan of the parent.
     * When nothing matches, the plain resolution is returned so callers can
     * still report a sensible path.
     */
    public static Path resolveCaseAware(Path root, String relative) {
        String norm = normalize(relative);
        if (norm.isEmpty()) return root;

        Path cur = root;
        for (String seg : norm.split("/")) {
            if (seg.isEmpty() || seg.equals(".")) continue;
            Path exact = cur.resolve(seg);
            if (Files.exists(exact)) {
                cur = exact;
                continue;
            }
            Path found = findIgnoreCase(cur, seg);
            if (found == null) return root.resolve(norm);
            cur = found;
        }
        return cur;
    }

    public static boolean exists(Path root, String relative) {
        return Files.exists(resolveCaseAware(root, relative));
    }

    public static boolean isDirectory(Path root, String relative) {
        return Files.isDirectory(resolveCaseAware(root, relative));
    }

    public static boolean isFile(Path root, String relative) {
        return Files.isRegularFile(resolveCaseAware(root, relative));
    }

    private static Path findIgnoreCase(Path dir, String name) {
        if (!Files.isDirectory(dir)) return null;
        String want = name.toLowerCase(Locale.ROOT);
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir)) {
            for (Path p : ds) {
                Path fn = p.getFileName();
                if (fn != null && fn.toString().toLowerCase(Locale.ROOT).equals(want)) return p;
            }
        } catch (IOException ignored) {
            // unreadable directory behaves like a miss
        }
        return null;
    }
}
