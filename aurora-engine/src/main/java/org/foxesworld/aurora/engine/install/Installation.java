package org.foxesworld.aurora.engine.install;

// Author: Calista Verner

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.aurora.core.CaseInsensitiveMap;
import org.foxesworld.aurora.core.FileResource;
import org.foxesworld.aurora.core.FoldedName;
import org.foxesworld.aurora.core.LocationResult;
import org.foxesworld.aurora.core.ResourceIdentifier;
import org.foxesworld.aurora.core.ResourceResult;
import org.foxesworld.aurora.core.ResourceType;
import org.foxesworld.aurora.core.io.PathNorm;
import org.foxesworld.aurora.engine.archive.Capsule;
import org.foxesworld.aurora.engine.archive.CapsuleFiles;
import org.foxesworld.aurora.engine.archive.Chitin;
import org.foxesworld.aurora.engine.game.GameDetector;
import org.foxesworld.aurora.engine.game.GameVariant;
import org.foxesworld.aurora.engine.game.UndeterminedGameException;
import org.foxesworld.aurora.engine.media.LocalizedString;
import org.foxesworld.aurora.engine.media.SoundFixup;
import org.foxesworld.aurora.engine.media.TalkTable;
import org.foxesworld.aurora.engine.media.TextureData;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Resource store over one game installation directory.
 * <p>
 * Every location category is indexed lazily into its own {@link LocationCache}
 * on first use and stays loaded until reloaded or cleared. Queries take a
 * {@link SearchScope} that fixes the category order; results for one identifier
 * always follow that order.
 * <p>
 * Not thread-safe. One instance belongs to one owning context; callers that
 * share it across threads must synchronize externally.
 */
public final class Installation implements Iterable<FileResource> {

    private static final Logger log = LogManager.getLogger(Installation.class);

    public static final String MODULES_DIR = "modules";
    public static final String OVERRIDE_DIR = "override";
    public static final String LIPS_DIR = "lips";
    public static final String TEXTUREPACKS_DIR = "texturepacks";
    public static final String RIMS_DIR = "rims";
    public static final String MUSIC_DIR = "streammusic";
    public static final String SOUNDS_DIR = "streamsounds";
    public static final String WAVES_DIR = "streamwaves";
    public static final String VOICE_DIR = "streamvoice";
    public static final String TALKTABLE_FILE = "dialog.tlk";
    public static final String FEMALE_TALKTABLE_FILE = "dialogf.tlk";
    public static final String PATCH_ERF_FILE = "patch.erf";
    public static final String SAVES_DIR = "saves";
    public static final String CLOUDSAVES_DIR = "cloudsaves";

    private static final List<ResourceType> TEXTURE_TYPES = List.of(ResourceType.TPC, ResourceType.TGA);
    private static final List<ResourceType> SOUND_TYPES = List.of(ResourceType.WAV, ResourceType.MP3);

    private final Path root;
    private final TalkTable talkTable;
    private final TalkTable femaleTalkTable;
    private final SoundFixup soundFixup;

    private GameVariant game;

    private final LocationCache<List<FileResource>> chitin;
    private final LocationCache<List<FileResource>> patch;
    private final LocationCache<CaseInsensitiveMap<List<FileResource>>> modules;
    private final LocationCache<CaseInsensitiveMap<List<FileResource>>> lips;
    private final LocationCache<CaseInsensitiveMap<List<FileResource>>> texturePacks;
    private final LocationCache<CaseInsensitiveMap<List<FileResource>>> rims;
    private final LocationCache<CaseInsensitiveMap<List<FileResource>>> override;
    private final LocationCache<List<FileResource>> music;
    private final LocationCache<List<FileResource>> sounds;
    private final LocationCache<List<FileResource>> voice;
    private final LocationCache<CaseInsensitiveMap<List<FileResource>>> saves;

    private Installation(Builder b) {
        this.root = b.root;
        this.talkTable = b.talkTable;
        this.femaleTalkTable = b.femaleTalkTable;
        this.soundFixup = b.soundFixup;
        this.game = b.game;

        this.chitin = new LocationCache<>("chitin", this::loadChitin);
        this.patch = new LocationCache<>("patch", this::loadPatch);
        this.modules = new LocationCache<>("modules", () -> LocationLoader.capsules(modulePath(), CapsuleFiles::isCapsule));
        this.lips = new LocationCache<>("lips", () -> LocationLoader.capsules(lipsPath(), CapsuleFiles::isMod));
        this.texturePacks = new LocationCache<>("texturepacks", () -> LocationLoader.capsules(texturePacksPath(), CapsuleFiles::isErf));
        this.rims = new LocationCache<>("rims", () -> LocationLoader.capsules(rimsPath(), CapsuleFiles::isRim));
        this.override = new LocationCache<>("override", () -> LocationLoader.overrideTree(overridePath()));
        this.music = new LocationCache<>("music", () -> LocationLoader.looseFiles(streamMusicPath(), false));
        this.sounds = new LocationCache<>("sounds", () -> LocationLoader.looseFiles(streamSoundsPath(), false));
        this.voice = new LocationCache<>("voice", this::loadVoice);
        this.saves = new LocationCache<>("saves", () -> LocationLoader.saveFolders(root, saveLocations()));
    }

    public static Installation open(Path root) {
        return builder(root).build();
    }

    public static Builder builder(Path root) {
        return new Builder(root);
    }

    // ---------------------------------------------------------------------
    // Paths

    public Path path() { return root; }

    public Path modulePath() { return PathNorm.resolveCaseAware(root, MODULES_DIR); }

    public Path overridePath() { return PathNorm.resolveCaseAware(root, OVERRIDE_DIR); }

    public Path lipsPath() { return PathNorm.resolveCaseAware(root, LIPS_DIR); }

    public Path texturePacksPath() { return PathNorm.resolveCaseAware(root, TEXTUREPACKS_DIR); }

    public Path rimsPath() { return PathNorm.resolveCaseAware(root, RIMS_DIR); }

    public Path streamMusicPath() { return PathNorm.resolveCaseAware(root, MUSIC_DIR); }

    public Path streamSoundsPath() { return PathNorm.resolveCaseAware(root, SOUNDS_DIR); }

    /**
     * Voice-over folder. When only one of {@code streamwaves}/{@code streamvoice}
     * exists it is used; otherwise the game decides (first title: streamwaves).
     *
     * @throws UndeterminedGameException when the choice needs the game and it is unknown
     */
    public Path streamVoicePath() {
        Path waves = PathNorm.resolveCaseAware(root, WAVES_DIR);
        Path voices = PathNorm.resolveCaseAware(root, VOICE_DIR);
        boolean hasWaves = Files.isDirectory(waves);
        boolean hasVoices = Files.isDirectory(voices);
        if (hasWaves != hasVoices) return hasWaves ? waves : voices;
        return game().isK2() ? voices : waves;
    }

    public Path talkTablePath() { return PathNorm.resolveCaseAware(root, TALKTABLE_FILE); }

    public Path femaleTalkTablePath() { return PathNorm.resolveCaseAware(root, FEMALE_TALKTABLE_FILE); }

    public Path savesPath() { return PathNorm.resolveCaseAware(root, SAVES_DIR); }

    /**
     * Folders that hold save-game folders: {@code saves}, then every user folder
     * under {@code cloudsaves}. Only the ones that exist are returned.
     */
    public List<Path> saveLocations() {
        List<Path> out = new ArrayList<>();
        Path local = savesPath();
        if (Files.isDirectory(local)) {
            out.add(local);
        } else {
            log.info("No '{}' folder at {}, no local saves", SAVES_DIR, root);
        }
        Path cloud = PathNorm.resolveCaseAware(root, CLOUDSAVES_DIR);
        if (Files.isDirectory(cloud)) {
            for (Path p : LocationLoader.listSorted(cloud)) {
                if (Files.isDirectory(p)) out.add(p);
            }
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Game identity

    /**
     * Declared or detected game, memoized after the first success.
     *
     * @throws UndeterminedGameException when detection is inconclusive
     */
    public GameVariant game() {
        if (game != null) return game;
        GameVariant detected = GameDetector.identify(root).orElseThrow(() -> new UndeterminedGameException(root));
        log.info("Installation at {} detected as {}", root, detected);
        game = detected;
        return detected;
    }

    // ---------------------------------------------------------------------
    // Loaders

    private List<FileResource> loadChitin() {
        Path keyPath = PathNorm.resolveCaseAware(root, Chitin.KEY_FILENAME);
        if (!Files.isRegularFile(keyPath)) {
            log.info("[chitin] no {} at {}, archive index is empty", Chitin.KEY_FILENAME, root);
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(Chitin.load(root, keyPath).resources());
        } catch (IOException e) {
            throw new InstallationException("Archive index unreadable: " + keyPath, e);
        }
    }

    private List<FileResource> loadPatch() {
        Path patchPath = PathNorm.resolveCaseAware(root, PATCH_ERF_FILE);
        if (!Files.isRegularFile(patchPath)) return new ArrayList<>();
        if (!game().isK1()) {
            log.debug("[chitin] {} ignored for {}", PATCH_ERF_FILE, game());
            return new ArrayList<>();
        }
        List<FileResource> members = LocationLoader.capsule(patchPath);
        return members == null ? new ArrayList<>() : new ArrayList<>(members);
    }

    private List<FileResource> loadVoice() {
        boolean hasWaves = PathNorm.isDirectory(root, WAVES_DIR);
        boolean hasVoices = PathNorm.isDirectory(root, VOICE_DIR);
        if (!hasWaves && !hasVoices) {
            log.info("No voice folder at {}, nothing to index", root);
            return new ArrayList<>();
        }
        return LocationLoader.looseFiles(streamVoicePath(), true);
    }

    // ---------------------------------------------------------------------
    // Listing / reload accessors

    public List<FileResource> chitinResources() {
        return Collections.unmodifiableList(chitin.get());
    }

    /** Archive index plus, for first-title installs, the members of {@code patch.erf}. */
    public List<FileResource> coreResources() {
        List<FileResource> out = new ArrayList<>(chitin.get());
        out.addAll(patch.get());
        return Collections.unmodifiableList(out);
    }

    public List<String> modulesList() { return modules.get().keys(); }

    public List<FileResource> moduleResources(String filename) {
        return copyOf(modules.get().get(filename));
    }

    public List<String> lipsList() { return lips.get().keys(); }

    public List<FileResource> lipResources(String filename) {
        return copyOf(lips.get().get(filename));
    }

    public List<String> texturePacksList() { return texturePacks.get().keys(); }

    public List<FileResource> texturePackResources(String filename) {
        return copyOf(texturePacks.get().get(filename));
    }

    public List<String> rimsList() { return rims.get().keys(); }

    public List<FileResource> rimResources(String filename) {
        return copyOf(rims.get().get(filename));
    }

    /** Override directories as relative POSIX paths, {@code "."} for the root. */
    public List<String> overrideList() { return override.get().keys(); }

    /** Files directly inside one override directory, or every override file when {@code dir} is null. */
    public List<FileResource> overrideResources(String dir) {
        CaseInsensitiveMap<List<FileResource>> tree = override.get();
        if (dir == null) {
            List<FileResource> out = new ArrayList<>();
            for (List<FileResource> l : tree.values()) out.addAll(l);
            return Collections.unmodifiableList(out);
        }
        return copyOf(tree.get(normalizeOverrideDir(dir)));
    }

    public List<FileResource> musicResources() { return Collections.unmodifiableList(music.get()); }

    public List<FileResource> soundResources() { return Collections.unmodifiableList(sounds.get()); }

    public List<FileResource> voiceResources() { return Collections.unmodifiableList(voice.get()); }

    /** Save-game folders as POSIX paths relative to the root, e.g. {@code saves/000001 - game0}. */
    public List<String> savesList() { return saves.get().keys(); }

    /** Files of one save-game folder, keyed as in {@link #savesList()}. */
    public List<FileResource> saveResources(String folder) {
        return copyOf(saves.get().get(PathNorm.normalize(folder)));
    }

    public boolean isSavesLoaded() { return saves.isLoaded(); }

    public void reloadChitin() {
        chitin.reload();
        patch.reload();
    }

    public void reloadModules() { modules.reload(); }

    /** Re-reads one module container; drops it from the index when it no longer opens. */
    public void reloadModule(String filename) {
        CaseInsensitiveMap<List<FileResource>> map = modules.get();
        Path file = PathNorm.resolveCaseAware(modulePath(), filename);
        List<FileResource> members = Files.isRegularFile(file) ? LocationLoader.capsule(file) : null;
        if (members == null) {
            map.remove(filename);
            log.info("Module '{}' removed from index", filename);
        } else {
            map.put(filename, members);
        }
    }

    public void reloadLips() { lips.reload(); }

    public void reloadTexturePacks() { texturePacks.reload(); }

    public void reloadRims() { rims.reload(); }

    public void reloadOverride() { override.reload(); }

    /** Re-reads one override directory and everything below it. */
    public void reloadOverride(String dir) {
        String key = normalizeOverrideDir(dir);
        if (".".equals(key)) {
            reloadOverride();
            return;
        }
        Path folder = PathNorm.resolveCaseAware(overridePath(), key);
        CaseInsensitiveMap<List<FileResource>> tree = override.get();
        String prefix = FoldedName.fold(key) + "/";
        for (String k : tree.keys()) {
            String folded = FoldedName.fold(k);
            if (folded.equals(FoldedName.fold(key)) || folded.startsWith(prefix)) tree.remove(k);
        }
        if (!Files.isDirectory(folder)) return;

        String base = PathNorm.relativize(overridePath(), folder);
        for (Map.Entry<String, List<FileResource>> e : LocationLoader.overrideTree(folder).entries()) {
            String sub = e.getKey();
            tree.put(".".equals(sub) ? base : base + "/" + sub, e.getValue());
        }
    }

    /**
     * Updates the entry for one override file in place. {@code file} is absolute
     * or relative to the override folder.
     */
    public void reloadOverrideFile(Path file) {
        Path overrideRoot = overridePath();
        Path abs = file.isAbsolute() ? file : overrideRoot.resolve(file);
        Path parent = abs.getParent();
        String key = parent == null ? "." : PathNorm.relativize(overrideRoot, parent);

        CaseInsensitiveMap<List<FileResource>> tree = override.get();
        if (!tree.containsKey(key)) {
            reloadOverride(key);
        }

        ResourceIdentifier id = ResourceIdentifier.fromPath(abs);
        if (id.type().isInvalid()) {
            log.warn("Cannot reload override file '{}': unknown resource type", abs);
            return;
        }

        List<FileResource> list = tree.computeIfAbsent(key, k -> new ArrayList<>());
        list.removeIf(fr -> fr.identifier().equals(id));
        if (Files.isRegularFile(abs)) {
            FileResource fr = LocationLoader.looseFile(abs);
            if (fr != null) list.add(fr);
        }
    }

    public void reloadMusic() { music.reload(); }

    public void reloadSounds() { sounds.reload(); }

    public void reloadVoice() { voice.reload(); }

    public void reloadSaves() { saves.reload(); }

    /** Reloads one category. Uncached categories are ignored. */
    public void reload(SearchLocation location) {
        switch (location) {
            case OVERRIDE -> reloadOverride();
            case MODULES -> reloadModules();
            case CHITIN -> reloadChitin();
            case TEXTURES_TPA, TEXTURES_TPB, TEXTURES_TPC, TEXTURES_GUI -> reloadTexturePacks();
            case MUSIC -> reloadMusic();
            case SOUND -> reloadSounds();
            case VOICE -> reloadVoice();
            case LIPS -> reloadLips();
            case RIMS -> reloadRims();
            case CUSTOM_MODULES, CUSTOM_FOLDERS -> log.debug("{} is not cached, nothing to reload", location);
        }
    }

    public void reloadAll() {
        reloadChitin();
        reloadModules();
        reloadLips();
        reloadTexturePacks();
        reloadRims();
        reloadOverride();
        reloadMusic();
        reloadSounds();
        reloadVoice();
        reloadSaves();
        log.info("Installation at {} fully indexed", root);
    }

    /** Drops every index back to unloaded. The detected game is kept. */
    public void clearCaches() {
        for (LocationCache<?> c : caches()) c.clear();
    }

    public boolean isLoaded(SearchLocation location) {
        return switch (location) {
            case OVERRIDE -> override.isLoaded();
            case MODULES -> modules.isLoaded();
            case CHITIN -> chitin.isLoaded() && patch.isLoaded();
            case TEXTURES_TPA, TEXTURES_TPB, TEXTURES_TPC, TEXTURES_GUI -> texturePacks.isLoaded();
            case MUSIC -> music.isLoaded();
            case SOUND -> sounds.isLoaded();
            case VOICE -> voice.isLoaded();
            case LIPS -> lips.isLoaded();
            case RIMS -> rims.isLoaded();
            case CUSTOM_MODULES, CUSTOM_FOLDERS -> false;
        };
    }

    private List<LocationCache<?>> caches() {
        return List.of(chitin, patch, modules, lips, texturePacks, rims, override, music, sounds, voice, saves);
    }

    // ---------------------------------------------------------------------
    // Whole-installation views

    /** The root talk tables that exist, as loose pseudo-resources. */
    public List<FileResource> rootTalkTables() {
        List<FileResource> out = new ArrayList<>(2);
        for (Path p : List.of(talkTablePath(), femaleTalkTablePath())) {
            if (!Files.isRegularFile(p)) continue;
            FileResource fr = LocationLoader.looseFile(p);
            if (fr != null) out.add(fr);
        }
        return out;
    }

    /** Every indexed descriptor of every cached category plus the root talk tables. */
    public List<FileResource> allResources() {
        List<FileResource> out = new ArrayList<>(coreResources());
        for (List<FileResource> l : modules.get().values()) out.addAll(l);
        for (List<FileResource> l : lips.get().values()) out.addAll(l);
        for (List<FileResource> l : texturePacks.get().values()) out.addAll(l);
        for (List<FileResource> l : rims.get().values()) out.addAll(l);
        for (List<FileResource> l : override.get().values()) out.addAll(l);
        out.addAll(music.get());
        out.addAll(sounds.get());
        out.addAll(voice.get());
        out.addAll(rootTalkTables());
        return out;
    }

    @Override
    public Iterator<FileResource> iterator() {
        return allResources().iterator();
    }

    /** Identifier to every descriptor carrying it, in {@link #allResources()} order. */
    public Map<ResourceIdentifier, List<FileResource>> resourceIndex() {
        Map<ResourceIdentifier, List<FileResource>> out = new HashMap<>();
        for (FileResource fr : allResources()) {
            out.computeIfAbsent(fr.identifier(), k -> new ArrayList<>()).add(fr);
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Module grouping

    public String moduleRoot(String filename) {
        return ModuleNames.root(filename);
    }

    /** Module root to container filenames, best composite rank first. */
    public Map<String, List<String>> modulesByRoot() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (String fn : modules.get().keys()) {
            out.computeIfAbsent(ModuleNames.root(fn), k -> new ArrayList<>()).add(fn);
        }
        for (List<String> l : out.values()) l.sort(ModuleNames.BY_RANK);
        return out;
    }

    // ---------------------------------------------------------------------
    // Queries

    public Map<ResourceIdentifier, List<LocationResult>> locations(Collection<ResourceIdentifier> queries) {
        return locations(queries, SearchScope.defaults());
    }

    /**
     * Every location of every query, grouped per identifier in the scope's
     * category order. Misses map to an empty list.
     */
    public Map<ResourceIdentifier, List<LocationResult>> locations(Collection<ResourceIdentifier> queries, SearchScope scope) {
        Objects.requireNonNull(queries, "queries");
        Objects.requireNonNull(scope, "scope");

        Map<ResourceIdentifier, List<LocationResult>> out = new LinkedHashMap<>();
        for (ResourceIdentifier q : queries) out.putIfAbsent(q, new ArrayList<>());
        if (out.isEmpty()) return out;

        for (SearchLocation loc : scope.order()) {
            switch (loc) {
                case OVERRIDE -> scanMap(override.get(), loc, out);
                case MODULES -> scanModules(scope.moduleRootFilter().orElse(null), out);
                case CHITIN -> {
                    scanList(chitin.get(), loc, out);
                    scanList(patch.get(), loc, out);
                }
                case TEXTURES_TPA, TEXTURES_TPB, TEXTURES_TPC, TEXTURES_GUI ->
                        scanList(texturePacks.get().getOrDefault(loc.texturePackFile().orElseThrow(), List.of()), loc, out);
                case MUSIC -> scanList(music.get(), loc, out);
                case SOUND -> scanList(sounds.get(), loc, out);
                case VOICE -> scanList(voice.get(), loc, out);
                case LIPS -> scanMap(lips.get(), loc, out);
                case RIMS -> scanMap(rims.get(), loc, out);
                case CUSTOM_MODULES -> scanCapsules(scope.capsules(), out);
                case CUSTOM_FOLDERS -> scanFolders(scope.folders(), out);
            }
        }
        return out;
    }

    public List<LocationResult> location(String name, ResourceType type) {
        return location(name, type, SearchScope.defaults());
    }

    public List<LocationResult> location(String name, ResourceType type, SearchScope scope) {
        ResourceIdentifier id = new ResourceIdentifier(name, type);
        return locations(List.of(id), scope).get(id);
    }

    public Map<ResourceIdentifier, Optional<ResourceResult>> resources(Collection<ResourceIdentifier> queries) {
        return resources(queries, SearchScope.defaults());
    }

    /**
     * First location of each query, read through one handle per backing file.
     * All handles are closed before returning.
     *
     * @throws UncheckedIOException when a located byte range cannot be read
     */
    public Map<ResourceIdentifier, Optional<ResourceResult>> resources(Collection<ResourceIdentifier> queries, SearchScope scope) {
        Map<ResourceIdentifier, List<LocationResult>> found = locations(queries, scope);
        Map<ResourceIdentifier, Optional<ResourceResult>> out = new LinkedHashMap<>();
        try (HandlePool pool = new HandlePool()) {
            for (Map.Entry<ResourceIdentifier, List<LocationResult>> e : found.entrySet()) {
                ResourceIdentifier id = e.getKey();
                if (e.getValue().isEmpty()) {
                    log.debug("Resource {} not found in {}", id, scope.order());
                    out.put(id, Optional.empty());
                    continue;
                }
                LocationResult first = e.getValue().get(0);
                byte[] data = pool.read(first);
                out.put(id, Optional.of(new ResourceResult(id.name(), id.type(), first.path(), data, first.resource())));
            }
        }
        return out;
    }

    public Optional<ResourceResult> resource(String name, ResourceType type) {
        return resource(name, type, SearchScope.defaults());
    }

    public Optional<ResourceResult> resource(String name, ResourceType type, SearchScope scope) {
        ResourceIdentifier id = new ResourceIdentifier(name, type);
        return resources(List.of(id), scope).get(id);
    }

    // ---------------------------------------------------------------------
    // Textures

    public Optional<TextureData> texture(String name) {
        return texture(name, SearchScope.of(SearchScope.TEXTURE_ORDER));
    }

    public Optional<TextureData> texture(String name, SearchScope scope) {
        return textures(List.of(name), scope).get(name);
    }

    /**
     * TPC and TGA are two encodings of one texture. The encoding found in the
     * earliest category wins; within one category TPC is preferred. The first
     * TXI found is attached as text.
     */
    public Map<String, Optional<TextureData>> textures(Collection<String> names, SearchScope scope) {
        List<ResourceIdentifier> queries = new ArrayList<>();
        for (String n : names) {
            for (ResourceType t : TEXTURE_TYPES) queries.add(new ResourceIdentifier(n, t));
            queries.add(new ResourceIdentifier(n, ResourceType.TXI));
        }
        Map<ResourceIdentifier, List<LocationResult>> found = locations(queries, scope);

        Map<String, Optional<TextureData>> out = new LinkedHashMap<>();
        try (HandlePool pool = new HandlePool()) {
            for (String n : names) {
                if (out.containsKey(n)) continue;
                LocationResult best = null;
                ResourceType bestType = null;
                for (ResourceType t : TEXTURE_TYPES) {
                    List<LocationResult> locs = found.get(new ResourceIdentifier(n, t));
                    if (locs.isEmpty()) continue;
                    LocationResult cand = locs.get(0);
                    if (best == null || categoryIndex(scope, cand) < categoryIndex(scope, best)) {
                        best = cand;
                        bestType = t;
                    }
                }
                if (best == null) {
                    log.debug("Texture '{}' not found", n);
                    out.put(n, Optional.empty());
                    continue;
                }

                ResourceResult image = new ResourceResult(n, bestType, best.path(), pool.read(best), best.resource());
                String txi = "";
                List<LocationResult> txiLocs = found.get(new ResourceIdentifier(n, ResourceType.TXI));
                if (!txiLocs.isEmpty()) {
                    txi = new String(pool.read(txiLocs.get(0)), StandardCharsets.US_ASCII).trim();
                } else {
                    log.debug("'{}.txi' not found during texture lookup", n);
                }
                out.put(n, Optional.of(new TextureData(n, image, txi)));
            }
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Sounds

    public Optional<byte[]> sound(String name) {
        return sound(name, SearchScope.of(SearchScope.SOUND_ORDER));
    }

    public Optional<byte[]> sound(String name, SearchScope scope) {
        return sounds(List.of(name), scope).get(name);
    }

    /** WAV before MP3; bytes pass through the configured {@link SoundFixup}. */
    public Map<String, Optional<byte[]>> sounds(Collection<String> names, SearchScope scope) {
        List<ResourceIdentifier> queries = new ArrayList<>();
        for (String n : names) {
            for (ResourceType t : SOUND_TYPES) queries.add(new ResourceIdentifier(n, t));
        }
        Map<ResourceIdentifier, List<LocationResult>> found = locations(queries, scope);

        Map<String, Optional<byte[]>> out = new LinkedHashMap<>();
        try (HandlePool pool = new HandlePool()) {
            for (String n : names) {
                if (out.containsKey(n)) continue;
                LocationResult best = null;
                ResourceType bestType = null;
                for (ResourceType t : SOUND_TYPES) {
                    List<LocationResult> locs = found.get(new ResourceIdentifier(n, t));
                    if (locs.isEmpty()) continue;
                    LocationResult cand = locs.get(0);
                    if (best == null || categoryIndex(scope, cand) < categoryIndex(scope, best)) {
                        best = cand;
                        bestType = t;
                    }
                }
                if (best == null) {
                    log.warn("Sound '{}' not found", n);
                    out.put(n, Optional.empty());
                    continue;
                }
                out.put(n, Optional.of(soundFixup.apply(n, bestType, pool.read(best))));
            }
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Strings

    public String string(LocalizedString text, String defaultText) {
        return strings(List.of(text), defaultText).get(text);
    }

    /**
     * Resolves each string through the primary talk table, then the secondary
     * one, then its first embedded substring, then {@code defaultText}.
     */
    public Map<LocalizedString, String> strings(Collection<LocalizedString> texts, String defaultText) {
        List<Integer> refs = new ArrayList<>();
        for (LocalizedString t : texts) {
            if (t.hasRef()) refs.add(t.stringRef());
        }
        Map<Integer, String> primary = talkTable.batch(refs);
        Map<Integer, String> secondary = femaleTalkTable.batch(refs);

        Map<LocalizedString, String> out = new LinkedHashMap<>();
        for (LocalizedString t : texts) {
            String s = null;
            if (t.hasRef()) {
                s = primary.get(t.stringRef());
                if (s == null) s = secondary.get(t.stringRef());
            }
            if (s == null) s = t.firstSubstring().orElse(defaultText);
            out.put(t, s);
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Scanning

    private static void scanList(List<FileResource> list, SearchLocation loc, Map<ResourceIdentifier, List<LocationResult>> out) {
        for (FileResource fr : list) {
            List<LocationResult> hits = out.get(fr.identifier());
            if (hits != null) hits.add(fr.location(loc.name()));
        }
    }

    private static void scanMap(CaseInsensitiveMap<List<FileResource>> map, SearchLocation loc,
                                Map<ResourceIdentifier, List<LocationResult>> out) {
        for (List<FileResource> list : map.values()) {
            scanList(list, loc, out);
        }
    }

    /**
     * Modules with composite grouping: of the containers holding an identifier,
     * only the best-ranked one per module root answers. Groups keep discovery order.
     */
    private void scanModules(String rootFilter, Map<ResourceIdentifier, List<LocationResult>> out) {
        String filter = rootFilter == null ? null : FoldedName.fold(rootFilter);
        Map<ResourceIdentifier, LinkedHashMap<String, Candidate>> best = new HashMap<>();

        for (Map.Entry<String, List<FileResource>> e : modules.get().entries()) {
            String filename = e.getKey();
            String moduleRoot = ModuleNames.root(filename);
            if (filter != null && !filter.equals(moduleRoot)) continue;
            int rank = ModuleNames.rank(filename);

            for (FileResource fr : e.getValue()) {
                if (!out.containsKey(fr.identifier())) continue;
                LinkedHashMap<String, Candidate> groups = best.computeIfAbsent(fr.identifier(), k -> new LinkedHashMap<>());
                Candidate cur = groups.get(moduleRoot);
                if (cur == null) {
                    groups.put(moduleRoot, new Candidate(fr, rank));
                } else if (rank < cur.rank()) {
                    groups.put(moduleRoot, new Candidate(fr, rank));
                }
            }
        }

        for (Map.Entry<ResourceIdentifier, LinkedHashMap<String, Candidate>> e : best.entrySet()) {
            List<LocationResult> hits = out.get(e.getKey());
            for (Candidate c : e.getValue().values()) {
                hits.add(c.resource().location(SearchLocation.MODULES.name()));
            }
        }
    }

    private record Candidate(FileResource resource, int rank) {}

    private static void scanCapsules(List<Capsule> capsules, Map<ResourceIdentifier, List<LocationResult>> out) {
        for (Capsule capsule : capsules) {
            for (Map.Entry<ResourceIdentifier, List<LocationResult>> e : out.entrySet()) {
                capsule.info(e.getKey()).ifPresent(fr -> e.getValue().add(fr.location(SearchLocation.CUSTOM_MODULES.name())));
            }
        }
    }

    private static void scanFolders(List<Path> folders, Map<ResourceIdentifier, List<LocationResult>> out) {
        for (Path folder : folders) {
            scanList(LocationLoader.looseFiles(folder, false), SearchLocation.CUSTOM_FOLDERS, out);
        }
    }

    private static int categoryIndex(SearchScope scope, LocationResult loc) {
        if (loc.source() == null) return Integer.MAX_VALUE;
        int idx = scope.order().indexOf(SearchLocation.valueOf(loc.source()));
        return idx < 0 ? Integer.MAX_VALUE : idx;
    }

    private static List<FileResource> copyOf(List<FileResource> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    private static String normalizeOverrideDir(String dir) {
        String n = PathNorm.normalize(dir);
        return n.isEmpty() ? "." : n;
    }

    /** One read handle per backing file for the duration of a query. */
    private static final class HandlePool implements AutoCloseable {
        private final Map<Path, FileChannel> open = new HashMap<>();

        byte[] read(LocationResult loc) {
            try {
                FileChannel ch = open.get(loc.path());
                if (ch == null) {
                    ch = FileChannel.open(loc.path(), StandardOpenOption.READ);
                    open.put(loc.path(), ch);
                }
                FileResource fr = loc.resource();
                if (fr == null) {
                    fr = new FileResource(ResourceIdentifier.fromPath(loc.path()), loc.path(), loc.offset(), loc.size());
                }
                return fr.read(ch);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read " + loc, e);
            }
        }

        @Override
        public void close() {
            IOException first = null;
            for (FileChannel ch : open.values()) {
                try {
                    ch.close();
                } catch (IOException e) {
                    if (first == null) first = e;
                    else first.addSuppressed(e);
                }
            }
            open.clear();
            if (first != null) {
                log.warn("Failed to close {} handle(s): {}", 1 + first.getSuppressed().length, first.getMessage(), first);
            }
        }
    }

    // ---------------------------------------------------------------------

    public static final class Builder {
        private final Path root;
        private TalkTable talkTable = TalkTable.EMPTY;
        private TalkTable femaleTalkTable = TalkTable.EMPTY;
        private SoundFixup soundFixup = SoundFixup.IDENTITY;
        private GameVariant game;
        private boolean eager;

        private Builder(Path root) {
            this.root = Objects.requireNonNull(root, "root");
        }

        public Builder talkTable(TalkTable table) {
            this.talkTable = table == null ? TalkTable.EMPTY : table;
            return this;
        }

        public Builder femaleTalkTable(TalkTable table) {
            this.femaleTalkTable = table == null ? TalkTable.EMPTY : table;
            return this;
        }

        public Builder soundFixup(SoundFixup fixup) {
            this.soundFixup = fixup == null ? SoundFixup.IDENTITY : fixup;
            return this;
        }

        /** Skips detection; useful for console dumps, which detection cannot recognize. */
        public Builder game(GameVariant variant) {
            this.game = variant;
            return this;
        }

        /** Index every category at build time instead of on first use. */
        public Builder eager(boolean eager) {
            this.eager = eager;
            return this;
        }

        /**
         * @throws InstallationException when the root is not a directory or has no modules folder
         */
        public Installation build() {
            if (!Files.isDirectory(root)) {
                throw new InstallationException("Installation root is not a directory: " + root);
            }
            if (!PathNorm.isDirectory(root, MODULES_DIR)) {
                throw new InstallationException("No '" + MODULES_DIR + "' folder in " + root + ", not a game installation");
            }
            Installation inst = new Installation(this);
            log.info("Opened installation at {}", root);
            if (eager) inst.reloadAll();
            return inst;
        }
    }

    @Override
    public String toString() {
        Set<String> loaded = new HashSet<>();
        for (LocationCache<?> c : caches()) {
            if (c.isLoaded()) loaded.add(c.name());
        }
        return "Installation{" + root + ", loaded=" + loaded + '}';
    }
}
