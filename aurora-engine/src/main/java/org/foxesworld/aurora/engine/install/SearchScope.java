package org.foxesworld.aurora.engine.install;

import org.foxesworld.aurora.engine.archive.Capsule;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * What a query searches and in which order.
 * <p>
 * {@code order} lists categories by priority; a category repeated later in the
 * list is ignored. {@code capsules} and {@code folders} feed
 * {@link SearchLocation#CUSTOM_MODULES} and {@link SearchLocation#CUSTOM_FOLDERS}.
 * {@code moduleRoot}, when set, restricts {@link SearchLocation#MODULES} to one module.
 */
public record SearchScope(List<SearchLocation> order, List<Capsule> capsules, List<Path> folders, String moduleRoot) {

    public static final List<SearchLocation> DEFAULT_ORDER = List.of(
            SearchLocation.CUSTOM_FOLDERS,
            SearchLocation.OVERRIDE,
            SearchLocation.CUSTOM_MODULES,
            SearchLocation.MODULES,
            SearchLocation.CHITIN);

    public static final List<SearchLocation> TEXTURE_ORDER = List.of(
            SearchLocation.CUSTOM_FOLDERS,
            SearchLocation.OVERRIDE,
            SearchLocation.CUSTOM_MODULES,
            SearchLocation.TEXTURES_TPA,
            SearchLocation.CHITIN);

    public static final List<SearchLocation> SOUND_ORDER = List.of(
            SearchLocation.CUSTOM_FOLDERS,
            SearchLocation.OVERRIDE,
            SearchLocation.CUSTOM_MODULES,
            SearchLocation.SOUND,
            SearchLocation.CHITIN);

    public SearchScope {
        order = List.copyOf(new LinkedHashSet<>(Objects.requireNonNull(order, "order")));
        capsules = capsules == null ? List.of() : List.copyOf(capsules);
        folders = folders == null ? List.of() : List.copyOf(folders);
    }

    public static SearchScope defaults() {
        return new SearchScope(DEFAULT_ORDER, null, null, null);
    }

    public static SearchScope of(SearchLocation... order) {
        return new SearchScope(Arrays.asList(order), null, null, null);
    }

    public static SearchScope of(List<SearchLocation> order) {
        return new SearchScope(order, null, null, null);
    }

    public Optional<String> moduleRootFilter() {
        return Optional.ofNullable(moduleRoot);
    }

    public SearchScope withOrder(List<SearchLocation> newOrder) {
        return new SearchScope(newOrder, capsules, folders, moduleRoot);
    }

    public SearchScope withCapsules(List<Capsule> extra) {
        return new SearchScope(order, extra, folders, moduleRoot);
    }

    public SearchScope withFolders(List<Path> extra) {
        return new SearchScope(order, capsules, extra, moduleRoot);
    }

    public SearchScope withModuleRoot(String root) {
        return new SearchScope(order, capsules, folders, root);
    }

    public SearchScope withCapsule(Capsule extra) {
        List<Capsule> l = new ArrayList<>(capsules);
        l.add(extra);
        return withCapsules(l);
    }

    public SearchScope withFolder(Path extra) {
        List<Path> l = new ArrayList<>(folders);
        l.add(extra);
        return withFolders(l);
    }
}
