package org.foxesworld.aurora.engine.resolve;

// Author: Calista Verner

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.aurora.core.FileResource;
import org.foxesworld.aurora.core.LocationResult;
import org.foxesworld.aurora.core.ResourceIdentifier;
import org.foxesworld.aurora.engine.archive.CapsuleFiles;
import org.foxesworld.aurora.engine.install.Installation;
import org.foxesworld.aurora.engine.install.SearchLocation;
import org.foxesworld.aurora.engine.install.SearchScope;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Picks, per installation, the copy of a resource the game would load.
 * <p>
 * Tiers, highest first: override, loose files at the installation root, primary
 * module containers ({@code .mod}), the remaining module containers after
 * composite grouping, then the archive index. Streamed audio and lips do not
 * take part.
 */
public final class CrossInstallationResolver {

    private static final Logger log = LogManager.getLogger(CrossInstallationResolver.class);

    static final SearchScope RESOLUTION_SCOPE =
            SearchScope.of(SearchLocation.OVERRIDE, SearchLocation.MODULES, SearchLocation.CHITIN);

    public ResolvedResource resolve(ResourceIdentifier identifier, Installation installation) {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(installation, "installation");

        Map<ResolutionTier, List<LocationResult>> tiers = new EnumMap<>(ResolutionTier.class);
        for (ResolutionTier t : ResolutionTier.values()) tiers.put(t, new ArrayList<>());

        for (LocationResult loc : installation.location(identifier.name(), identifier.type(), RESOLUTION_SCOPE)) {
            tiers.get(tierOf(loc)).add(loc);
        }
        for (FileResource fr : installation.rootTalkTables()) {
            if (fr.identifier().equals(identifier)) {
                tiers.get(ResolutionTier.INSTALLATION_ROOT).add(fr.location("INSTALLATION_ROOT"));
            }
        }

        LocationResult winner = null;
        ResolutionTier winnerTier = null;
        for (ResolutionTier t : ResolutionTier.values()) {
            List<LocationResult> l = tiers.get(t);
            if (!l.isEmpty()) {
                winner = l.get(0);
                winnerTier = t;
                break;
            }
        }

        Path root = installation.path();
        if (winner == null) {
            log.debug("{} not found in {}", identifier, root);
            return ResolvedResource.notFound(identifier, root);
        }

        byte[] data = null;
        String error = null;
        try {
            data = winner.resource().data();
        } catch (IOException e) {
            error = e.getClass().getSimpleName() + ": " + e.getMessage();
            log.warn("Found {} at {} but could not read it: {}", identifier, winner.path(), e.getMessage(), e);
        }

        String source = (data == null ? "Found but couldn't read: " : winnerTier.displayName() + ": ")
                + displayPath(root, winner.path());
        return new ResolvedResource(identifier, root, winner, winnerTier, data, source, tiers, error);
    }

    /** One result per installation, in input order. */
    public List<ResolvedResource> resolveAll(ResourceIdentifier identifier, List<Installation> installations) {
        List<ResolvedResource> out = new ArrayList<>(installations.size());
        for (Installation inst : installations) {
            out.add(resolve(identifier, inst));
        }
        return out;
    }

    /**
     * Side-by-side report: for every tier, every copy in every installation,
     * marked CHOSEN or shadowed.
     */
    public String explain(ResourceIdentifier identifier, List<Installation> installations) {
        List<ResolvedResource> results = resolveAll(identifier, installations);
        StringBuilder sb = new StringBuilder();
        sb.append("Resolution of ").append(identifier).append('\n');

        int n = 1;
        for (ResolutionTier t : ResolutionTier.values()) {
            String label = n++ + ". " + t.displayName();
            boolean any = false;
            for (ResolvedResource r : results) {
                String name = r.installationRoot().getFileName() == null
                        ? r.installationRoot().toString()
                        : r.installationRoot().getFileName().toString();
                for (LocationResult loc : r.locations(t)) {
                    any = true;
                    boolean chosen = loc.equals(r.winner());
                    sb.append("  ").append(label).append(" -> ")
                            .append(chosen ? "CHOSEN - " : "(shadowed) ")
                            .append(name).append('/').append(displayPath(r.installationRoot(), loc.path()))
                            .append('\n');
                }
            }
            if (!any) {
                sb.append("  ").append(label).append(" -> not found\n");
            }
        }
        return sb.toString();
    }

    static ResolutionTier tierOf(LocationResult loc) {
        SearchLocation src = SearchLocation.valueOf(loc.source());
        return switch (src) {
            case OVERRIDE -> ResolutionTier.OVERRIDE;
            case MODULES -> CapsuleFiles.isMod(loc.path().getFileName().toString())
                    ? ResolutionTier.MODULE_PRIMARY
                    : ResolutionTier.MODULE_COMPOSITE;
            case CHITIN -> ResolutionTier.CHITIN;
            default -> throw new IllegalStateException("Unexpected category in resolution: " + src);
        };
    }

    private static String displayPath(Path root, Path p) {
        try {
            return root.relativize(p).toString().replace('\\', '/');
        } catch (IllegalArgumentException e) {
            return p.toString();
        }
    }
}
