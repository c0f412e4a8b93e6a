package org.foxesworld.aurora.engine.resolve;

import org.foxesworld.aurora.core.LocationResult;
import org.foxesworld.aurora.core.ResourceIdentifier;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of resolving one identifier in one installation.
 * <p>
 * {@code winner} and {@code tier} are null when nothing was found. {@code data}
 * is null when nothing was found or the winner could not be read, in which
 * case {@code error} says why.
 */
public record ResolvedResource(ResourceIdentifier identifier,
                               Path installationRoot,
                               LocationResult winner,
                               ResolutionTier tier,
                               byte[] data,
                               String source,
                               Map<ResolutionTier, List<LocationResult>> allLocations,
                               String error) {

    public ResolvedResource {
        EnumMap<ResolutionTier, List<LocationResult>> copy = new EnumMap<>(ResolutionTier.class);
        if (allLocations != null) {
            allLocations.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        }
        allLocations = Collections.unmodifiableMap(copy);
    }

    static ResolvedResource notFound(ResourceIdentifier id, Path root) {
        return new ResolvedResource(id, root, null, null, null, "Not found in installation", null, null);
    }

    public boolean found() {
        return winner != null;
    }

    public Optional<LocationResult> winnerLocation() {
        return Optional.ofNullable(winner);
    }

    public Optional<byte[]> bytes() {
        return Optional.ofNullable(data);
    }

    public Optional<String> readError() {
        return Optional.ofNullable(error);
    }

    public List<LocationResult> locations(ResolutionTier t) {
        return allLocations.getOrDefault(t, List.of());
    }
}
