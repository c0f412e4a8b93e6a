package org.foxesworld.aurora.engine.install;

// Author: Calista Verner

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.foxesworld.aurora.engine.util.ReadProps;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.Locale;

/**
 * Module filename helpers.
 * <p>
 * One logical module may be split across {@code name.mod}, {@code name.rim},
 * {@code name_s.rim} and {@code name_dlg.erf}. All of them share a root
 * ({@code name}); within a root the {@code .mod} overrides the rest.
 */
public final class ModuleNames {
    private ModuleNames() {}

    public static final String CACHE_SIZE_PROPERTY = "aurora.modules.rootCacheSize";

    public static final int RANK_MOD = 0;
    public static final int RANK_RIM = 1;
    public static final int RANK_S_RIM = 2;
    public static final int RANK_DLG_ERF = 3;
    public static final int RANK_OTHER = 4;

    /**
     * Root by lowercase filename. Pure function of the name, so safe to share;
     * bounded because tools may feed it arbitrary paths.
     */
    private static final Cache<String, String> ROOTS = Caffeine.newBuilder()
            .maximumSize(ReadProps.readIntProperty(CACHE_SIZE_PROPERTY, 1_000))
            .build();

    public static final Comparator<String> BY_RANK = Comparator.comparingInt(ModuleNames::rank);

    /** Stem, lowercased, then {@code _s} and after it {@code _dlg} stripped once each. */
    public static String root(String filename) {
        if (filename == null) return "";
        String key = fileNameOf(filename).toLowerCase(Locale.ROOT);
        return ROOTS.get(key, ModuleNames::computeRoot);
    }

    public static String root(Path path) {
        Path fn = path.getFileName();
        return root(fn == null ? path.toString() : fn.toString());
    }

    /** Composite priority: lower wins. */
    public static int rank(String filename) {
        String f = fileNameOf(filename).toLowerCase(Locale.ROOT);
        if (f.endsWith(".mod")) return RANK_MOD;
        if (f.endsWith("_s.rim")) return RANK_S_RIM;
        if (f.endsWith(".rim")) return RANK_RIM;
        if (f.endsWith("_dlg.erf")) return RANK_DLG_ERF;
        return RANK_OTHER;
    }

    public static int rank(Path path) {
        Path fn = path.getFileName();
        return rank(fn == null ? path.toString() : fn.toString());
    }

    static long cachedRoots() {
        ROOTS.cleanUp();
        return ROOTS.estimatedSize();
    }

    private static String computeRoot(String lowerName) {
        int dot = lowerName.lastIndexOf('.');
        String root = dot > 0 ? lowerName.substring(0, dot) : lowerName;
        if (root.endsWith("_s")) root = root.substring(0, root.length() - 2);
        if (root.endsWith("_dlg")) root = root.substring(0, root.length() - 4);
        return root;
    }

    private static String fileNameOf(String name) {
        String n = name.replace('\\', '/');
        int slash = n.lastIndexOf('/');
        return slash >= 0 ? n.substring(slash + 1) : n;
    }
}
