package org.foxesworld.aurora.engine.resolve;

import org.foxesworld.aurora.core.ResourceIdentifier;
import org.foxesworld.aurora.core.ResourceType;
import org.foxesworld.aurora.engine.archive.ArchiveFixtures;
import org.foxesworld.aurora.engine.archive.ArchiveFixtures.Bif;
import org.foxesworld.aurora.engine.archive.ArchiveFixtures.Member;
import org.foxesworld.aurora.engine.install.Installation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CrossInstallationResolverTest {

    private static final ResourceIdentifier BANTHA = new ResourceIdentifier("c_bantha", ResourceType.UTC);

    @TempDir
    Path tmp;

    private final CrossInstallationResolver resolver = new CrossInstallationResolver();

    private Path install(String name, String chitinText) throws IOException {
        Path root = Files.createDirectories(tmp.resolve(name).resolve("modules"));
        root = root.getParent();
        ArchiveFixtures.chitin(root, List.of(new Bif("data/templates.bif", List.of(
                Member.of("c_bantha", ResourceType.UTC, chitinText),
                Member.of("dialog", ResourceType.TLK, "packed-tlk")))));
        return root;
    }

    private static String text(ResolvedResource r) {
        return new String(r.bytes().orElseThrow(), StandardCharsets.US_ASCII);
    }

    @Test
    void overrideWinsOverEverything() throws Exception {
        Path root = install("a", "chitin");
        ArchiveFixtures.file(root.resolve("override/c_bantha.utc"), "override");
        ArchiveFixtures.mod(root.resolve("modules/m01aa.mod"), List.of(Member.of("c_bantha", ResourceType.UTC, "mod")));

        ResolvedResource r = resolver.resolve(BANTHA, Installation.open(root));
        assertTrue(r.found());
        assertEquals(ResolutionTier.OVERRIDE, r.tier());
        assertEquals("override", text(r));
        assertEquals("Override folder: override/c_bantha.utc", r.source());
        assertEquals(1, r.locations(ResolutionTier.MODULE_PRIMARY).size());
        assertEquals(1, r.locations(ResolutionTier.CHITIN).size());
        assertTrue(r.readError().isEmpty());
    }

    @Test
    void modTierBeatsOtherContainers() throws Exception {
        Path root = install("a", "chitin");
        ArchiveFixtures.rim(root.resolve("modules/a01.rim"), List.of(Member.of("c_bantha", ResourceType.UTC, "rim")));
        ArchiveFixtures.mod(root.resolve("modules/b01.mod"), List.of(Member.of("c_bantha", ResourceType.UTC, "mod")));

        ResolvedResource r = resolver.resolve(BANTHA, Installation.open(root));
        assertEquals(ResolutionTier.MODULE_PRIMARY, r.tier());
        assertEquals("mod", text(r));
        assertEquals(1, r.locations(ResolutionTier.MODULE_COMPOSITE).size());
        assertEquals("Modules (.mod): modules/b01.mod", r.source());
    }

    @Test
    void compositeContainersAndArchiveIndex() throws Exception {
        Path root = install("a", "chitin");
        ArchiveFixtures.rim(root.resolve("modules/a01_s.rim"), List.of(Member.of("c_bantha", ResourceType.UTC, "static")));

        ResolvedResource r = resolver.resolve(BANTHA, Installation.open(root));
        assertEquals(ResolutionTier.MODULE_COMPOSITE, r.tier());
        assertEquals("static", text(r));

        Path plain = install("b", "chitin-only");
        ResolvedResource fromIndex = resolver.resolve(BANTHA, Installation.open(plain));
        assertEquals(ResolutionTier.CHITIN, fromIndex.tier());
        assertEquals("chitin-only", text(fromIndex));
        assertEquals("Chitin BIFs: data/templates.bif", fromIndex.source());
    }

    @Test
    void rootTalkTableBeatsArchiveIndex() throws Exception {
        Path root = install("a", "chitin");
        ArchiveFixtures.file(root.resolve("dialog.tlk"), "loose-tlk");

        ResolvedResource r = resolver.resolve(new ResourceIdentifier("dialog", ResourceType.TLK), Installation.open(root));
        assertEquals(ResolutionTier.INSTALLATION_ROOT, r.tier());
        assertEquals("loose-tlk", text(r));
        assertEquals("Installation root: dialog.tlk", r.source());
        assertEquals(1, r.locations(ResolutionTier.CHITIN).size());
    }

    @Test
    void missingResourceIsReported() throws Exception {
        Path root = install("a", "chitin");

        ResolvedResource r = resolver.resolve(new ResourceIdentifier("ghost", ResourceType.UTC), Installation.open(root));
        assertFalse(r.found());
        assertNull(r.tier());
        assertTrue(r.bytes().isEmpty());
        assertEquals("Not found in installation", r.source());
        assertTrue(r.locations(ResolutionTier.OVERRIDE).isEmpty());
    }

    @Test
    void unreadableWinnerKeepsLocationAndError() throws Exception {
        Path root = install("a", "chitin");
        Path loose = ArchiveFixtures.file(root.resolve("override/c_bantha.utc"), "override");
        Installation inst = Installation.open(root);
        inst.reloadOverride();
        Files.delete(loose);

        ResolvedResource r = resolver.resolve(BANTHA, inst);
        assertTrue(r.found());
        assertEquals(ResolutionTier.OVERRIDE, r.tier());
        assertTrue(r.bytes().isEmpty());
        assertTrue(r.readError().isPresent());
        assertEquals("Found but couldn't read: override/c_bantha.utc", r.source());
    }

    @Test
    void resolvesEachInstallationIndependently() throws Exception {
        Path a = install("a", "chitin-a");
        ArchiveFixtures.file(a.resolve("override/c_bantha.utc"), "override-a");
        Path b = install("b", "chitin-b");

        List<ResolvedResource> all = resolver.resolveAll(BANTHA, List.of(Installation.open(a), Installation.open(b)));
        assertEquals(2, all.size());
        assertEquals(a, all.get(0).installationRoot());
        assertEquals("override-a", text(all.get(0)));
        assertEquals(ResolutionTier.CHITIN, all.get(1).tier());
        assertEquals("chitin-b", text(all.get(1)));
    }

    @Test
    void explainMarksChosenAndShadowedCopies() throws Exception {
        Path a = install("a", "chitin-a");
        ArchiveFixtures.file(a.resolve("override/c_bantha.utc"), "override-a");
        Path b = install("b", "chitin-b");

        String report = resolver.explain(BANTHA, List.of(Installation.open(a), Installation.open(b)));
        assertTrue(report.startsWith("Resolution of c_bantha.utc\n"), report);
        assertTrue(report.contains("  1. Override folder -> CHOSEN - a/override/c_bantha.utc\n"), report);
        assertTrue(report.contains("  2. Installation root -> not found\n"), report);
        assertTrue(report.contains("  5. Chitin BIFs -> (shadowed) a/data/templates.bif\n"), report);
        assertTrue(report.contains("  5. Chitin BIFs -> CHOSEN - b/data/templates.bif\n"), report);
    }
}
