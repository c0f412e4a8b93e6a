package org.foxesworld.aurora.core;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Known resource type codes as stored in key tables and capsule member tables.
 * <p>
 * Each constant carries the numeric id used on disk, the canonical file extension
 * and a coarse {@link Kind} used by lookups that treat several types as one
 * logical resource (textures, sounds).
 */
public enum ResourceType {
    INVALID(-1, "", Kind.OTHER),

    RES(0, "res", Kind.GFF),
    BMP(1, "bmp", Kind.IMAGE),
    TGA(3, "tga", Kind.IMAGE),
    WAV(4, "wav", Kind.AUDIO),
    PLT(6, "plt", Kind.OTHER),
    INI(7, "ini", Kind.TEXT),
    MP3(8, "mp3", Kind.AUDIO),
    TXT(10, "txt", Kind.TEXT),
    MDL(2002, "mdl", Kind.MODEL),
    NSS(2009, "nss", Kind.TEXT),
    NCS(2010, "ncs", Kind.OTHER),
    MOD(2011, "mod", Kind.CAPSULE),
    ARE(2012, "are", Kind.GFF),
    SET(2013, "set", Kind.TEXT),
    IFO(2014, "ifo", Kind.GFF),
    BIC(2015, "bic", Kind.GFF),
    WOK(2016, "wok", Kind.MODEL),
    TWODA(2017, "2da", Kind.TABLE),
    TLK(2018, "tlk", Kind.OTHER),
    TXI(2022, "txi", Kind.TEXT),
    GIT(2023, "git", Kind.GFF),
    BTI(2024, "bti", Kind.GFF),
    UTI(2025, "uti", Kind.GFF),
    BTC(2026, "btc", Kind.GFF),
    UTC(2027, "utc", Kind.GFF),
    DLG(2029, "dlg", Kind.GFF),
    ITP(2030, "itp", Kind.GFF),
    BTT(2031, "btt", Kind.GFF),
    UTT(2032, "utt", Kind.GFF),
    DDS(2033, "dds", Kind.IMAGE),
    UTS(2035, "uts", Kind.GFF),
    LTR(2036, "ltr", Kind.OTHER),
    GFF(2037, "gff", Kind.GFF),
    FAC(2038, "fac", Kind.GFF),
    BTE(2039, "bte", Kind.GFF),
    UTE(2040, "ute", Kind.GFF),
    BTD(2041, "btd", Kind.GFF),
    UTD(2042, "utd", Kind.GFF),
    BTP(2043, "btp", Kind.GFF),
    UTP(2044, "utp", Kind.GFF),
    DFT(2045, "dft", Kind.TEXT),
    GIC(2046, "gic", Kind.GFF),
    GUI(2047, "gui", Kind.GFF),
    BTM(2050, "btm", Kind.GFF),
    UTM(2051, "utm", Kind.GFF),
    DWK(2052, "dwk", Kind.MODEL),
    PWK(2053, "pwk", Kind.MODEL),
    JRL(2056, "jrl", Kind.GFF),
    SAV(2057, "sav", Kind.CAPSULE),
    UTW(2058, "utw", Kind.GFF),
    SSF(2060, "ssf", Kind.OTHER),
    HAK(2061, "hak", Kind.CAPSULE),
    NDB(2064, "ndb", Kind.OTHER),
    PTM(2065, "ptm", Kind.GFF),
    PTT(2066, "ptt", Kind.GFF),
    LYT(3000, "lyt", Kind.TEXT),
    VIS(3001, "vis", Kind.TEXT),
    RIM(3002, "rim", Kind.CAPSULE),
    PTH(3003, "pth", Kind.GFF),
    LIP(3004, "lip", Kind.OTHER),
    BWM(3005, "bwm", Kind.MODEL),
    TXB(3006, "txb", Kind.IMAGE),
    TPC(3007, "tpc", Kind.IMAGE),
    MDX(3008, "mdx", Kind.MODEL),
    RSV(3009, "rsv", Kind.OTHER),
    SIG(3010, "sig", Kind.OTHER),
    ERF(9997, "erf", Kind.CAPSULE),
    BIF(9998, "bif", Kind.OTHER),
    KEY(9999, "key", Kind.OTHER);

    /** Coarse grouping of payloads. */
    public enum Kind {
        GFF, TABLE, TEXT, IMAGE, AUDIO, MODEL, CAPSULE, OTHER
    }

    private static final Map<Integer, ResourceType> BY_ID = new HashMap<>();
    private static final Map<String, ResourceType> BY_EXTENSION = new HashMap<>();

    static {
        for (ResourceType t : values()) {
            if (t == INVALID) continue;
            BY_ID.putIfAbsent(t.id, t);
            BY_EXTENSION.putIfAbsent(t.extension, t);
        }
    }

    private final int id;
    private final String extension;
    private final Kind kind;

    ResourceType(int id, String extension, Kind kind) {
        this.id = id;
        this.extension = extension;
        this.kind = kind;
    }

    public int id() { return id; }

    public String extension() { return extension; }

    public Kind kind() { return kind; }

    public boolean isInvalid() { return this == INVALID; }

    public static ResourceType fromId(long id) {
        if (id < Integer.MIN_VALUE || id > Integer.MAX_VALUE) return INVALID;
        return BY_ID.getOrDefault((int) id, INVALID);
    }

    /**
     * Looks up a type by file extension. Case-insensitive; a leading dot is ignored.
     */
    public static ResourceType fromExtension(String extension) {
        if (extension == null) return INVALID;
        String ext = extension.trim();
        if (ext.startsWith(".")) ext = ext.substring(1);
        if (ext.isEmpty()) return INVALID;
        return BY_EXTENSION.getOrDefault(ext.toLowerCase(Locale.ROOT), INVALID);
    }
}
