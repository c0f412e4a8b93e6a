package org.foxesworld.aurora.engine.archive;

import java.nio.file.Path;
import java.util.Locale;

/** Filename classification for archive containers. */
public final class CapsuleFiles {
    private CapsuleFiles() {}

    public static boolean isCapsule(String filename) {
        return isErfFamily(filename) || isRim(filename);
    }

    public static boolean isCapsule(Path path) {
        return path != null && path.getFileName() != null && isCapsule(path.getFileName().toString());
    }

    /** erf, mod, sav, hak: the ERF member layout. */
    public static boolean isErfFamily(String filename) {
        String ext = extension(filename);
        return ext.equals("erf") || ext.equals("mod") || ext.equals("sav") || ext.equals("hak");
    }

    public static boolean isMod(String filename) {
        return extension(filename).equals("mod");
    }

    public static boolean isErf(String filename) {
        return extension(filename).equals("erf");
    }

    public static boolean isRim(String filename) {
        return extension(filename).equals("rim");
    }

    public static boolean isSav(String filename) {
        return extension(filename).equals("sav");
    }

    public static boolean isBif(String filename) {
        String ext = extension(filename);
        return ext.equals("bif") || ext.equals("bzf");
    }

    public static String extension(String filename) {
        if (filename == null) return "";
        int dot = filename.lastIndexOf('.');
        int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        if (dot < 0 || dot < slash) return "";
        return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
