package io.skymosaic.catalog;

import io.skymosaic.model.Band;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class ConfidenceMapCacheTest {
    private static final Map<Band, List<String>> CANDIDATES = Map.of(
            Band.HA, List.of("Halpha_conf.fit", "ha_conf.fit", "h_conf.fit"),
            Band.R, List.of("r_conf.fit"),
            Band.I, List.of("i_conf.fit"));

    @Test
    void substitutedDirectoryResolvesToItsReplacement() throws Exception {
        Path data = Files.createTempDirectory("skymosaic-confmap-");
        try {
            Files.createDirectories(data.resolve("run13"));
            touch(data.resolve("run12/ha_conf.fit"));
            ConfidenceMapCache cache = new ConfidenceMapCache(data, CANDIDATES, Map.of("run13", "run12"));

            Path resolved = cache.resolve(data.resolve("run13"), Band.HA);

            Assertions.assertEquals(data.toAbsolutePath().normalize().resolve("run12/ha_conf.fit"), resolved);
        } finally {
            deleteRecursively(data);
        }
    }

    @Test
    void lastExistingCandidateWins() throws Exception {
        Path data = Files.createTempDirectory("skymosaic-confmap-order-");
        try {
            touch(data.resolve("night/h_conf.fit"));
            touch(data.resolve("night/Halpha_conf.fit"));
            ConfidenceMapCache cache = new ConfidenceMapCache(data, CANDIDATES, Map.of());

            Assertions.assertEquals("h_conf.fit",
                    cache.resolve(data.resolve("night"), Band.HA).getFileName().toString());
        } finally {
            deleteRecursively(data);
        }
    }

    @Test
    void resolvedPathIsStableForTheRun() throws Exception {
        Path data = Files.createTempDirectory("skymosaic-confmap-memo-");
        try {
            Path confmap = data.resolve("night/r_conf.fit");
            touch(confmap);
            ConfidenceMapCache cache = new ConfidenceMapCache(data, CANDIDATES, Map.of());

            Path first = cache.resolve(data.resolve("night"), Band.R);
            Files.delete(confmap);
            Path second = cache.resolve(data.resolve("night"), Band.R);

            Assertions.assertEquals(first, second);
            Assertions.assertEquals(1, cache.size());
        } finally {
            deleteRecursively(data);
        }
    }

    @Test
    void missingConfidenceMapIsFatal() throws Exception {
        Path data = Files.createTempDirectory("skymosaic-confmap-missing-");
        try {
            Files.createDirectories(data.resolve("night"));
            touch(data.resolve("night/r_conf.fit"));
            ConfidenceMapCache cache = new ConfidenceMapCache(data, CANDIDATES, Map.of());

            UnresolvedConfidenceMapException error = Assertions.assertThrows(UnresolvedConfidenceMapException.class,
                    () -> cache.resolve(data.resolve("night"), Band.I));
            Assertions.assertEquals(Band.I, error.band());
            Assertions.assertEquals(0, cache.size());
        } finally {
            deleteRecursively(data);
        }
    }

    static void touch(Path file) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, "SIMPLE  = T");
    }

    static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
