package org.foxesworld.aurora.engine.game;

// Author: Calista Verner

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.aurora.core.io.PathNorm;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Guesses the {@link GameVariant} of an installation from file existence probes.
 * <p>
 * Each variant has a fixed checklist of relative paths; its score is the number
 * that exist (case-aware). The strictly highest score wins. A tie for the top
 * or an all-zero result means "unknown". Console checklists are empty, so
 * console variants are never detected, only declared.
 */
public final class GameDetector {

    private static final Logger log = LogManager.getLogger(GameDetector.class);

    private static final Map<GameVariant, List<String>> PROBES = new EnumMap<>(GameVariant.class);

    static {
        PROBES.put(GameVariant.K1, List.of(
                "streamwaves",
                "swkotor.exe",
                "swkotor.ini",
                "swkotorconfig.exe",
                "rims",
                "utils",
                "patch.erf",
                "data/party.bif",
                "data/player.bif",
                "modules/global.mod",
                "lips/global.mod"));
        PROBES.put(GameVariant.K2, List.of(
                "streamvoice",
                "swkotor2.exe",
                "swkotor2.ini",
                "swupdate.exe",
                "localvault",
                "lips/localization.mod",
                "modules/001ebo.mod",
                "modules/001ebo_dlg.erf",
                "data/dialogs.bif",
                "data/lips.bif"));
        PROBES.put(GameVariant.K1_XBOX, List.of());
        PROBES.put(GameVariant.K2_XBOX, List.of());
        PROBES.put(GameVariant.K1_IOS, List.of(
                "override/ios_action_bg.tga",
                "override/ios_action_bg2.tga",
                "override/ios_action_x.tga",
                "override/ios_action_x2.tga",
                "override/ios_button_a.tga",
                "override/ios_button_x.tga",
                "override/ios_button_y.tga",
                "override/ios_edit_box.tga",
                "override/ios_enemy_plus.tga",
                "override/ios_gpad_bg.tga",
                "override/ios_gpad_gen.tga",
                "override/ios_gpad_gen2.tga",
                "override/ios_gpad_help.tga",
                "override/ios_gpad_help2.tga",
                "override/ios_gpad_map.tga",
                "override/ios_gpad_map2.tga",
                "override/ios_gpad_save.tga",
                "override/ios_gpad_save2.tga",
                "override/ios_gpad_solo.tga",
                "override/ios_gpad_solo2.tga",
                "override/ios_gpad_solox.tga",
                "override/ios_gpad_solox2.tga",
                "override/ios_gpad_ste.tga",
                "override/ios_gpad_ste2.tga",
                "override/ios_gpad_ste3.tga",
                "override/ios_help.tga",
                "override/ios_help2.tga",
                "override/ios_help_1.tga",
                "KOTOR",
                "KOTOR.entitlements",
                "streamwaves/globe",
                "data/party.bif",
                "data/player.bif"));
        PROBES.put(GameVariant.K2_IOS, List.of(
                "override/ios_mfr_gen.tga",
                "override/ios_mfr_gen2.tga",
                "override/ios_mfr_mer.tga",
                "override/ios_mfr_pwk.tga",
                "override/ios_mfr_skl.tga",
                "override/ios_mfr_wrk.tga",
                "KOTOR II",
                "KOTOR II.entitlements",
                "streamvoice",
                "data/dialogs.bif",
                "data/lips.bif"));
        PROBES.put(GameVariant.K1_ANDROID, List.of(
                "assets/swkotor.ini",
                "lib/arm64-v8a/libswkotor.so",
                "streamwaves",
                "data/party.bif",
                "data/player.bif"));
        PROBES.put(GameVariant.K2_ANDROID, List.of(
                "assets/swkotor2.ini",
                "lib/arm64-v8a/libswkotor2.so",
                "streamvoice",
                "data/dialogs.bif",
                "data/lips.bif"));
    }

    private GameDetector() {}

    public static Optional<GameVariant> identify(Path root) {
        Objects.requireNonNull(root, "root");
        if (!Files.isDirectory(root)) return Optional.empty();

        Map<GameVariant, Integer> scores = scores(root);
        GameVariant best = null;
        int bestScore = 0;
        boolean tie = false;
        for (Map.Entry<GameVariant, Integer> e : scores.entrySet()) {
            int s = e.getValue();
            if (s > bestScore) {
                best = e.getKey();
                bestScore = s;
                tie = false;
            } else if (s == bestScore && s > 0) {
                tie = true;
            }
        }

        if (best == null || tie) {
            log.debug("Game at {} undetermined: {}", root, scores);
            return Optional.empty();
        }
        log.debug("Game at {} identified as {} ({})", root, best, scores);
        return Optional.of(best);
    }

    /** Per-variant probe counts, in enum order. */
    public static Map<GameVariant, Integer> scores(Path root) {
        Map<GameVariant, Integer> out = new EnumMap<>(GameVariant.class);
        for (Map.Entry<GameVariant, List<String>> e : PROBES.entrySet()) {
            int score = 0;
            for (String probe : e.getValue()) {
                if (PathNorm.exists(root, probe)) score++;
            }
            out.put(e.getKey(), score);
        }
        return out;
    }

    static List<String> probes(GameVariant variant) {
        return PROBES.getOrDefault(variant, List.of());
    }
}
