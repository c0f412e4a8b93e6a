package org.foxesworld.aurora.engine.watch;

import org.foxesworld.aurora.core.ResourceType;
import org.foxesworld.aurora.engine.archive.ArchiveFixtures;
import org.foxesworld.aurora.engine.install.Installation;
import org.foxesworld.aurora.engine.install.SearchLocation;
import org.foxesworld.aurora.engine.install.SearchScope;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class InstallationWatcherTest {

    @TempDir
    Path root;

    @Test
    void mapsPathsToCategories() {
        assertEquals(Optional.of(SearchLocation.OVERRIDE), InstallationWatcher.locationOf("override/sub/x.utc"));
        assertEquals(Optional.of(SearchLocation.OVERRIDE), InstallationWatcher.locationOf("Override\\x.utc"));
        assertEquals(Optional.of(SearchLocation.MODULES), InstallationWatcher.locationOf("modules/m01aa.mod"));
        assertEquals(Optional.of(SearchLocation.LIPS), InstallationWatcher.locationOf("lips/global.mod"));
        assertEquals(Optional.of(SearchLocation.RIMS), InstallationWatcher.locationOf("rims/xbox.rim"));
        assertEquals(Optional.of(SearchLocation.MUSIC), InstallationWatcher.locationOf("streammusic/mus_a.wav"));
        assertEquals(Optional.of(SearchLocation.SOUND), InstallationWatcher.locationOf("StreamSounds/hit.wav"));
        assertEquals(Optional.of(SearchLocation.VOICE), InstallationWatcher.locationOf("streamwaves/n/line.wav"));
        assertEquals(Optional.of(SearchLocation.VOICE), InstallationWatcher.locationOf("streamvoice/line.wav"));
        assertEquals(Optional.of(SearchLocation.TEXTURES_TPB), InstallationWatcher.locationOf("texturepacks/SWPC_TEX_TPB.ERF"));
        assertEquals(Optional.of(SearchLocation.TEXTURES_TPA), InstallationWatcher.locationOf("texturepacks/custom.erf"));
        assertEquals(Optional.of(SearchLocation.CHITIN), InstallationWatcher.locationOf("data/templates.bif"));
        assertEquals(Optional.of(SearchLocation.CHITIN), InstallationWatcher.locationOf("./chitin.key"));
        assertEquals(Optional.of(SearchLocation.CHITIN), InstallationWatcher.locationOf("patch.erf"));
    }

    @Test
    void bareCategoryFoldersMapToTheirCategory() {
        assertEquals(Optional.of(SearchLocation.OVERRIDE), InstallationWatcher.locationOf("override"));
        assertEquals(Optional.of(SearchLocation.MODULES), InstallationWatcher.locationOf("Modules/"));
        assertEquals(Optional.of(SearchLocation.LIPS), InstallationWatcher.locationOf("lips"));
        assertEquals(Optional.of(SearchLocation.RIMS), InstallationWatcher.locationOf("rims"));
        assertEquals(Optional.of(SearchLocation.MUSIC), InstallationWatcher.locationOf("streammusic"));
        assertEquals(Optional.of(SearchLocation.SOUND), InstallationWatcher.locationOf("streamsounds"));
        assertEquals(Optional.of(SearchLocation.VOICE), InstallationWatcher.locationOf("StreamWaves"));
        assertEquals(Optional.of(SearchLocation.TEXTURES_TPA), InstallationWatcher.locationOf("texturepacks"));
        assertEquals(Optional.of(SearchLocation.CHITIN), InstallationWatcher.locationOf("data"));
        assertEquals(Optional.empty(), InstallationWatcher.locationOf("chitin.key/stray"));
    }

    @Test
    void createdOverrideFolderTriggersReload() throws Exception {
        Installation inst = Installation.open(Files.createDirectories(root.resolve("modules")).getParent());
        assertTrue(inst.overrideList().isEmpty());
        ArchiveFixtures.file(root.resolve("override/late.utc"), "late");

        try (InstallationWatcher watcher = new InstallationWatcher(root)) {
            watcher.markChanged("override");
            assertEquals(Set.of(SearchLocation.OVERRIDE), watcher.applyTo(inst));
            assertEquals(1, inst.overrideResources(".").size());
        }
    }

    @Test
    void ignoresUnrelatedPaths() {
        assertEquals(Optional.empty(), InstallationWatcher.locationOf("saves/000001/savegame.sav"));
        assertEquals(Optional.empty(), InstallationWatcher.locationOf("swkotor.exe"));
        assertEquals(Optional.empty(), InstallationWatcher.locationOf("data/readme.txt"));
        assertEquals(Optional.empty(), InstallationWatcher.locationOf(""));
        assertEquals(Optional.empty(), InstallationWatcher.locationOf(null));
    }

    @Test
    void reloadsOnlyLoadedCategories() throws Exception {
        Files.createDirectories(root.resolve("modules"));
        Files.createDirectories(root.resolve("override"));
        Installation inst = Installation.open(root);
        SearchScope overrideOnly = SearchScope.of(SearchLocation.OVERRIDE);
        assertTrue(inst.resource("fresh", ResourceType.UTC, overrideOnly).isEmpty());

        ArchiveFixtures.file(root.resolve("override/fresh.utc"), "new");

        try (InstallationWatcher watcher = new InstallationWatcher(root)) {
            watcher.markChanged("override/fresh.utc");
            watcher.markChanged("modules/m01aa.mod");
            watcher.markChanged("swkotor.ini");

            Set<SearchLocation> reloaded = watcher.applyTo(inst);
            assertEquals(Set.of(SearchLocation.OVERRIDE), reloaded);
            assertTrue(inst.resource("fresh", ResourceType.UTC, overrideOnly).isPresent());
            assertFalse(inst.isLoaded(SearchLocation.MODULES));

            assertTrue(watcher.applyTo(inst).isEmpty(), "changes are drained once applied");
        }
    }

    @Test
    void pollReportsMarkedCategories() throws Exception {
        try (InstallationWatcher watcher = new InstallationWatcher(root)) {
            assertEquals(root.toAbsolutePath().normalize(), watcher.root());
            assertTrue(watcher.pollChanged().isEmpty());

            watcher.markChanged("data\\2da.bif");
            watcher.markChanged("lips/x.mod");
            assertEquals(Set.of(SearchLocation.CHITIN, SearchLocation.LIPS), watcher.pollChanged());
        }
    }
}
