package org.foxesworld.aurora.engine.install;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ModuleNamesTest {

    @Test
    void stripsCompanionSuffixes() {
        assertEquals("m01aa", ModuleNames.root("m01aa.mod"));
        assertEquals("m01aa", ModuleNames.root("M01AA.rim"));
        assertEquals("m01aa", ModuleNames.root("m01aa_s.rim"));
        assertEquals("m01aa", ModuleNames.root("m01aa_dlg.erf"));
        assertEquals("m01aa", ModuleNames.root(Path.of("modules", "m01aa_s.rim")));
    }

    @Test
    void stripsStaticBeforeDialog() {
        // _s is stripped first, so "x_dlg_s" loses both while "x_s_dlg" keeps "_s"
        assertEquals("x", ModuleNames.root("x_dlg_s.rim"));
        assertEquals("x_s", ModuleNames.root("x_s_dlg.erf"));
    }

    @Test
    void ranksCompositeForms() {
        assertEquals(ModuleNames.RANK_MOD, ModuleNames.rank("m01aa.mod"));
        assertEquals(ModuleNames.RANK_RIM, ModuleNames.rank("m01aa.rim"));
        assertEquals(ModuleNames.RANK_S_RIM, ModuleNames.rank("m01aa_s.rim"));
        assertEquals(ModuleNames.RANK_DLG_ERF, ModuleNames.rank("M01AA_DLG.ERF"));
        assertEquals(ModuleNames.RANK_OTHER, ModuleNames.rank("m01aa.erf"));
    }

    @Test
    void sortsByRank() {
        List<String> files = new ArrayList<>(List.of("a_dlg.erf", "a_s.rim", "a.rim", "a.mod"));
        files.sort(ModuleNames.BY_RANK);
        assertEquals(List.of("a.mod", "a.rim", "a_s.rim", "a_dlg.erf"), files);
    }

    @Test
    void memoizesRoots() {
        ModuleNames.root("memo_test_s.rim");
        assertTrue(ModuleNames.cachedRoots() >= 1);
    }
}
