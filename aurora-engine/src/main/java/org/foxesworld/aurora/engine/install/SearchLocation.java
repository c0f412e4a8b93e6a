package org.foxesworld.aurora.engine.install;

import java.util.Optional;

/** Categories an installation can be searched in. */
public enum SearchLocation {
    /** Loose files under {@code override}, including subdirectories. */
    OVERRIDE,
    /** Module capsules under {@code modules}. */
    MODULES,
    /** The archive index ({@code chitin.key} and its blobs). */
    CHITIN,
    TEXTURES_TPA("swpc_tex_tpa.erf"),
    TEXTURES_TPB("swpc_tex_tpb.erf"),
    TEXTURES_TPC("swpc_tex_tpc.erf"),
    TEXTURES_GUI("swpc_tex_gui.erf"),
    MUSIC,
    SOUND,
    VOICE,
    LIPS,
    RIMS,
    /** Caller-supplied capsules, never cached. */
    CUSTOM_MODULES,
    /** Caller-supplied folders, never cached. */
    CUSTOM_FOLDERS;

    private final String texturePack;

    SearchLocation() {
        this(null);
    }

    SearchLocation(String texturePack) {
        this.texturePack = texturePack;
    }

    public boolean isCached() {
        return this != CUSTOM_MODULES && this != CUSTOM_FOLDERS;
    }

    public boolean isTexturePack() {
        return texturePack != null;
    }

    /** Fixed filename of the texture pack this category reads. */
    public Optional<String> texturePackFile() {
        return Optional.ofNullable(texturePack);
    }
}
