package io.skymosaic.catalog;

import io.skymosaic.model.Band;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves the confidence map that belongs to a directory of raw exposures.
 *
 * <p>Every candidate is probed in order inside the directory, or inside its
 * substitute when the directory is a known exception that ships without
 * confidence maps; the last one that exists wins. A resolved path is memoized per (directory, band) and never
 * changes afterwards.
 */
public final class ConfidenceMapCache {
    private static final Logger LOG = LoggerFactory.getLogger(ConfidenceMapCache.class);

    private final Path dataDir;
    private final Map<Band, List<String>> candidates;
    private final Map<String, String> substitutions;
    private final Map<Key, Path> resolved = new HashMap<>();

    public ConfidenceMapCache(Path dataDir, Map<Band, List<String>> candidates, Map<String, String> substitutions) {
        this.dataDir = dataDir.toAbsolutePath().normalize();
        this.candidates = Map.copyOf(candidates);
        this.substitutions = Map.copyOf(substitutions);
    }

    public synchronized Path resolve(Path directory, Band band) {
        Path dir = directory.toAbsolutePath().normalize();
        Key key = new Key(dir, band);
        Path hit = resolved.get(key);
        if (hit != null) {
            return hit;
        }
        Path searchDir = substitute(dir);
        Path found = null;
        for (String name : candidates.getOrDefault(band, List.of())) {
            Path candidate = searchDir.resolve(name);
            if (Files.isRegularFile(candidate)) {
                found = candidate;
            }
        }
        if (found == null) {
            throw new UnresolvedConfidenceMapException(dir, band);
        }
        resolved.put(key, found);
        if (!searchDir.equals(dir)) {
            LOG.debug("Confidence map for {} ({}) taken from {}", dir, band, searchDir);
        }
        return found;
    }

    public synchronized int size() {
        return resolved.size();
    }

    private Path substitute(Path dir) {
        if (!dir.startsWith(dataDir)) {
            return dir;
        }
        String relative = dataDir.relativize(dir).toString().replace('\\', '/');
        String replacement = substitutions.get(relative);
        return replacement == null ? dir : dataDir.resolve(replacement).normalize();
    }

    private record Key(Path directory, Band band) {
        private Key {
            Objects.requireNonNull(directory, "directory");
            Objects.requireNonNull(band, "band");
        }
    }
}
