package org.foxesworld.aurora.engine.install;

// Author: Calista Verner

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.aurora.core.CaseInsensitiveMap;
import org.foxesworld.aurora.core.FileResource;
import org.foxesworld.aurora.core.FoldedName;
import org.foxesworld.aurora.core.ResourceIdentifier;
import org.foxesworld.aurora.core.io.PathNorm;
import org.foxesworld.aurora.engine.archive.Capsule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Builds location indexes from the filesystem.
 * <p>
 * Directory entries are visited sorted by case-folded filename, so discovery
 * order is stable for a given snapshot. A missing directory yields an empty
 * index; a single unreadable entry is logged and skipped.
 */
public final class LocationLoader {
    private LocationLoader() {}

    private static final Logger log = LogManager.getLogger(LocationLoader.class);

    static final Comparator<Path> BY_FOLDED_NAME =
            Comparator.comparing((Path p) -> FoldedName.fold(String.valueOf(p.getFileName())))
                    .thenComparing(p -> String.valueOf(p.getFileName()));

    /** Loose files with a known type. Subdirectories are walked only when {@code recurse}. */
    public static List<FileResource> looseFiles(Path dir, boolean recurse) {
        List<FileResource> out = new ArrayList<>();
        if (dir == null || !Files.isDirectory(dir)) {
            log.info("Folder '{}' not found, nothing to index", dir);
            return out;
        }
        collectLoose(dir, recurse, out);
        return out;
    }

    private static void collectLoose(Path dir, boolean recurse, List<FileResource> out) {
        List<Path> subdirs = new ArrayList<>();
        for (Path p : listSorted(dir)) {
            if (Files.isDirectory(p)) {
                if (recurse) subdirs.add(p);
                continue;
            }
            FileResource fr = looseFile(p);
            if (fr != null) out.add(fr);
        }
        for (Path sub : subdirs) {
            collectLoose(sub, true, out);
        }
    }

    /**
     * Indexes every capsule directly under {@code dir}, keyed by container filename.
     */
    public static CaseInsensitiveMap<List<FileResource>> capsules(Path dir, Predicate<String> filter) {
        CaseInsensitiveMap<List<FileResource>> out = new CaseInsensitiveMap<>();
        if (dir == null || !Files.isDirectory(dir)) {
            log.info("Folder '{}' not found, no capsules indexed", dir);
            return out;
        }
        for (Path p : listSorted(dir)) {
            String fn = p.getFileName().toString();
            if (!Files.isRegularFile(p) || !filter.test(fn)) continue;
            List<FileResource> members = capsule(p);
            if (members != null) out.put(fn, members);
        }
        return out;
    }

    /** Members of one capsule, or null when it cannot be opened. */
    public static List<FileResource> capsule(Path file) {
        try {
            return Capsule.open(file).resources();
        } catch (IOException | RuntimeException e) {
            log.warn("Capsule '{}' unreadable, skipped: {}", file, e.getMessage(), e);
            return null;
        }
    }

    /**
     * Override tree: one key per directory (relative POSIX path, {@code "."} for
     * the root), each holding only that directory's direct files.
     */
    public static CaseInsensitiveMap<List<FileResource>> overrideTree(Path dir) {
        CaseInsensitiveMap<List<FileResource>> out = new CaseInsensitiveMap<>();
        if (dir == null || !Files.isDirectory(dir)) {
            log.info("Override folder '{}' not found, nothing to index", dir);
            return out;
        }
        collectTree(dir, dir, out);
        return out;
    }

    /**
     * Save-game folders found directly under each location, keyed by their path
     * relative to {@code root}. Each holds the folder's direct files.
     */
    public static CaseInsensitiveMap<List<FileResource>> saveFolders(Path root, List<Path> locations) {
        CaseInsensitiveMap<List<FileResource>> out = new CaseInsensitiveMap<>();
        for (Path location : locations) {
            log.debug("Save location '{}'", location);
            for (Path p : listSorted(location)) {
                if (!Files.isDirectory(p)) continue;
                out.put(PathNorm.relativize(root, p), looseFiles(p, false));
            }
        }
        log.info("Indexed {} save folder(s) under {}", out.size(), root);
        return out;
    }

    private static void collectTree(Path root, Path dir, CaseInsensitiveMap<List<FileResource>> out) {
        List<FileResource> files = new ArrayList<>();
        List<Path> subdirs = new ArrayList<>();
        for (Path p : listSorted(dir)) {
            if (Files.isDirectory(p)) {
                subdirs.add(p);
                continue;
            }
            FileResource fr = looseFile(p);
            if (fr != null) files.add(fr);
        }
        out.put(PathNorm.relativize(root, dir), files);
        for (Path sub : subdirs) {
            collectTree(root, sub, out);
        }
    }

    /** Descriptor for one loose file, or null when its type is unknown or it cannot be read. */
    static FileResource looseFile(Path p) {
        ResourceIdentifier id = ResourceIdentifier.fromPath(p);
        if (id.type().isInvalid()) {
            log.debug("Skipping '{}': unknown resource type", p);
            return null;
        }
        try {
            return new FileResource(id, p, 0, Files.size(p));
        } catch (IOException e) {
            log.warn("Skipping '{}': {}", p, e.getMessage(), e);
            return null;
        }
    }

    static List<Path> listSorted(Path dir) {
        try (Stream<Path> s = Files.list(dir)) {
            List<Path> out = new ArrayList<>(s.toList());
            out.sort(BY_FOLDED_NAME);
            return out;
        } catch (IOException e) {
            log.warn("Cannot list '{}': {}", dir, e.getMessage(), e);
            return List.of();
        }
    }
}
