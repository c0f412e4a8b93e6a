package org.foxesworld.aurora.engine.watch;

// Author: Calista Verner

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.aurora.core.FoldedName;
import org.foxesworld.aurora.engine.archive.CapsuleFiles;
import org.foxesworld.aurora.engine.archive.Chitin;
import org.foxesworld.aurora.engine.install.Installation;
import org.foxesworld.aurora.engine.install.SearchLocation;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

import static java.nio.file.StandardWatchEventKinds.*;
import static org.foxesworld.aurora.engine.util.ReadProps.readCsvProperty;

/**
 * Watches an installation folder and maps file changes to the search
 * categories they invalidate.
 * <p>
 * Call {@link #pollChanged()} or {@link #applyTo(Installation)} from the owner's
 * update loop; nothing is reloaded behind the owner's back.
 */
public final class InstallationWatcher implements Closeable {

    private static final Logger log = LogManager.getLogger(InstallationWatcher.class);

    private static final String DATA_DIR = "data";

    // Any directory segment matching these will be ignored (skipped + no events)
    private static final Set<String> IGNORED_DIR_NAMES = readCsvProperty("aurora.watch.ignore.dirs", new HashSet<>());

    private static final Set<String> IGNORED_FILE_NAMES = readCsvProperty("aurora.watch.ignore.files", new HashSet<>());

    private final Path root;
    private final WatchService watchService;

    // registered dirs (avoid double register)
    private final Set<Path> registered = ConcurrentHashMap.newKeySet();

    // changed paths relative to root
    private final Set<String> changed = ConcurrentHashMap.newKeySet();

    public InstallationWatcher(Path installationRoot) {
        try {
            this.root = installationRoot.toAbsolutePath().normalize();
            this.watchService = FileSystems.getDefault().newWatchService();
            registerAll(root);
            log.info("InstallationWatcher watching (recursive): {}", root);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start InstallationWatcher for " + installationRoot, e);
        }
    }

    public Path root() {
        return root;
    }

    /**
     * Category a root-relative path belongs to, or empty when changes there do
     * not affect any index (saves, executables, ...).
     */
    public static Optional<SearchLocation> locationOf(String relativePath) {
        if (relativePath == null) return Optional.empty();
        String rel = relativePath.replace('\\', '/');
        while (rel.startsWith("./")) rel = rel.substring(2);
        while (rel.startsWith("/")) rel = rel.substring(1);
        if (rel.isEmpty()) return Optional.empty();

        String[] segs = rel.split("/");
        String first = FoldedName.fold(segs[0]);

        // a bare category folder (created, deleted or renamed) invalidates its whole category
        boolean bare = segs.length == 1;
        String last = segs[segs.length - 1];

        return switch (first) {
            case Chitin.KEY_FILENAME, Installation.PATCH_ERF_FILE ->
                    bare ? Optional.of(SearchLocation.CHITIN) : Optional.empty();
            case Installation.OVERRIDE_DIR -> Optional.of(SearchLocation.OVERRIDE);
            case Installation.MODULES_DIR -> Optional.of(SearchLocation.MODULES);
            case Installation.LIPS_DIR -> Optional.of(SearchLocation.LIPS);
            case Installation.RIMS_DIR -> Optional.of(SearchLocation.RIMS);
            case Installation.MUSIC_DIR -> Optional.of(SearchLocation.MUSIC);
            case Installation.SOUNDS_DIR -> Optional.of(SearchLocation.SOUND);
            case Installation.WAVES_DIR, Installation.VOICE_DIR -> Optional.of(SearchLocation.VOICE);
            case Installation.TEXTUREPACKS_DIR ->
                    Optional.of(bare ? SearchLocation.TEXTURES_TPA : texturePackOf(last));
            case DATA_DIR -> bare || CapsuleFiles.isBif(last)
                    ? Optional.of(SearchLocation.CHITIN)
                    : Optional.empty();
            default -> Optional.empty();
        };
    }

    private static SearchLocation texturePackOf(String filename) {
        String fn = FoldedName.fold(filename);
        for (SearchLocation l : SearchLocation.values()) {
            if (l.texturePackFile().map(fn::equals).orElse(false)) return l;
        }
        return SearchLocation.TEXTURES_TPA;
    }

    private void registerDir(Path dir) throws IOException {
        Path norm = dir.toAbsolutePath().normalize();
        if (!Files.isDirectory(norm)) return;
        if (shouldIgnoreDir(norm)) return;
        if (!registered.add(norm)) return;

        norm.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
        log.debug("InstallationWatcher registered: {}", norm);
    }

    private void registerAll(Path start) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (shouldIgnoreDir(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                registerDir(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * Rule: if ANY path segment relative to root matches the ignored directory names, ignore.
     */
    private boolean shouldIgnoreDir(Path absDir) {
        Path abs = absDir.toAbsolutePath().normalize();
        if (!abs.startsWith(root)) return true;

        Path rel = root.relativize(abs);
        if (rel.getNameCount() == 0 || rel.toString().isEmpty()) return false;

        for (Path seg : rel) {
            if (IGNORED_DIR_NAMES.contains(seg.toString())) return true;
        }
        return false;
    }

    private boolean shouldIgnoreFile(Path absFile) {
        Path abs = absFile.toAbsolutePath().normalize();
        if (!abs.startsWith(root)) return true;

        Path parent = abs.getParent();
        if (parent != null && shouldIgnoreDir(parent)) return true;

        Path name = abs.getFileName();
        return name != null && IGNORED_FILE_NAMES.contains(name.toString());
    }

    /** Records a root-relative path as changed. */
    void markChanged(String relativePath) {
        if (relativePath != null && !relativePath.isBlank()) {
            changed.add(relativePath.replace('\\', '/'));
        }
    }

    /**
     * Drains pending watch events and returns the categories they touch.
     */
    public Set<SearchLocation> pollChanged() {
        WatchKey key;
        while ((key = watchService.poll()) != null) {
            Path watchedDir = (Path) key.watchable();

            for (WatchEvent<?> ev : key.pollEvents()) {
                WatchEvent.Kind<?> kind = ev.kind();
                if (kind == OVERFLOW) {
                    log.warn("InstallationWatcher overflow in {}, events lost", watchedDir);
                    continue;
                }

                @SuppressWarnings("unchecked")
                WatchEvent<Path> pev = (WatchEvent<Path>) ev;
                Path abs = watchedDir.resolve(pev.context()).toAbsolutePath().normalize();

                // If a new directory was created, start watching it too (unless ignored)
                if (kind == ENTRY_CREATE && Files.isDirectory(abs) && !shouldIgnoreDir(abs)) {
                    try {
                        registerAll(abs);
                    } catch (IOException ex) {
                        log.warn("InstallationWatcher: failed to register new dir {}", abs, ex);
                    }
                }

                boolean ignored = Files.isDirectory(abs) ? shouldIgnoreDir(abs) : shouldIgnoreFile(abs);
                if (!ignored) {
                    markChanged(root.relativize(abs).toString());
                    log.debug("Installation change: {} {}", kind.name(), abs);
                }
            }

            if (!key.reset()) {
                registered.remove(watchedDir);
            }
        }
        return drain();
    }

    private Set<SearchLocation> drain() {
        if (changed.isEmpty()) return Set.of();

        EnumSet<SearchLocation> out = EnumSet.noneOf(SearchLocation.class);
        for (String rel : new ArrayList<>(changed)) {
            changed.remove(rel);
            locationOf(rel).ifPresent(out::add);
        }
        return Collections.unmodifiableSet(out);
    }

    /**
     * Reloads every changed category the installation has already loaded.
     * Unloaded categories pick the change up on first use anyway.
     *
     * @return the categories that were reloaded
     */
    public Set<SearchLocation> applyTo(Installation installation) {
        Set<SearchLocation> touched = pollChanged();
        EnumSet<SearchLocation> reloaded = EnumSet.noneOf(SearchLocation.class);
        for (SearchLocation loc : touched) {
            if (installation.isLoaded(loc)) {
                installation.reload(loc);
                reloaded.add(loc);
            }
        }
        if (!reloaded.isEmpty()) {
            log.info("Reloaded {} after filesystem changes", reloaded);
        }
        return reloaded;
    }

    @Override
    public void close() {
        try {
            watchService.close();
        } catch (IOException e) {
            log.warn("InstallationWatcher: failed to close watch service", e);
        }
        registered.clear();
        changed.clear();
    }
}
