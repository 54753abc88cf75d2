package io.skymosaic.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Fixed per-tile layout under {@code <scratch>/<tileName>/}.
 */
public final class WorkingDirectory {
    private static final Logger LOG = LoggerFactory.getLogger(WorkingDirectory.class);

    private final Path root;
    private final String name;

    public WorkingDirectory(Path root, String name) {
        this.root = root;
        this.name = name;
    }

    public static WorkingDirectory of(Path scratchDir, String tileName) {
        return new WorkingDirectory(scratchDir.resolve(tileName), tileName);
    }

    public Path root() {
        return root;
    }

    public String name() {
        return name;
    }

    public Path orig() {
        return root.resolve("orig");
    }

    public Path conf() {
        return root.resolve("conf");
    }

    public Path proj() {
        return root.resolve("proj");
    }

    public Path diff() {
        return root.resolve("diff");
    }

    public Path corr() {
        return root.resolve("corr");
    }

    public Path imageTable() {
        return table("img");
    }

    public Path projectedTable() {
        return table("proj");
    }

    public Path diffTable() {
        return table("diff");
    }

    public Path fitTable() {
        return table("fit");
    }

    public Path correctionTable() {
        return table("corr");
    }

    public Path correctedImageTable() {
        return table("corrimg");
    }

    public Path header() {
        return root.resolve(name + ".hdr");
    }

    public Path expandedHeader() {
        return root.resolve(name + ".hdr.expanded");
    }

    public Path uncorrectedMosaic() {
        return root.resolve(name + "-uncorrected.fits");
    }

    public Path mosaic() {
        return root.resolve(name + ".fits");
    }

    /**
     * Creates the layout. An existing directory is reused, never wiped.
     *
     * @return false when the tile directory was already there
     */
    public boolean create() throws IOException {
        boolean existed = Files.isDirectory(root);
        if (existed) {
            LOG.warn("Dir already exists: {}", root);
        }
        for (Path dir : List.of(root, orig(), conf(), proj(), diff(), corr())) {
            Files.createDirectories(dir);
        }
        return !existed;
    }

    public void installHeaders(Path header, Path expandedHeader) throws IOException {
        Files.copy(header, header(), StandardCopyOption.REPLACE_EXISTING);
        Files.copy(expandedHeader, expandedHeader(), StandardCopyOption.REPLACE_EXISTING);
    }

    /**
     * Empties {@code diff/} and {@code corr/} so a rerun of the background
     * stages does not pick up stale products.
     */
    public void clearIntermediate() {
        for (Path dir : List.of(diff(), corr())) {
            if (!Files.isDirectory(dir)) {
                continue;
            }
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
                for (Path entry : stream) {
                    if (Files.isRegularFile(entry)) {
                        Files.delete(entry);
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to clear " + dir, e);
            }
            LOG.info("Cleared {}", dir);
        }
    }

    private Path table(String prefix) {
        return root.resolve(prefix + "-" + name + ".tbl");
    }
}
