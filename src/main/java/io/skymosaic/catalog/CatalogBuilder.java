package io.skymosaic.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Walks the raw data archive and writes the image catalog consumed by the
 * dispatcher.
 *
 * <p>An exposure whose run cannot be matched to a field is still listed, with
 * empty field, filter and confmap columns. A matched exposure whose directory
 * has no confidence map aborts the whole build.
 */
public final class CatalogBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(CatalogBuilder.class);
    private static final Pattern EXPOSURE = Pattern.compile("^r(\\d+)\\.fit");

    private final Path dataDir;
    private final SurveyMetadata metadata;
    private final ConfidenceMapCache confmaps;
    private final Set<String> ignoredDirectories;

    public CatalogBuilder(Path dataDir, SurveyMetadata metadata, ConfidenceMapCache confmaps, List<String> ignoredDirectories) {
        this.dataDir = dataDir.toAbsolutePath().normalize();
        this.metadata = metadata;
        this.confmaps = confmaps;
        this.ignoredDirectories = Set.copyOf(ignoredDirectories);
    }

    public List<CatalogRow> scan() {
        List<Path> exposures = findExposures();
        List<CatalogRow> rows = new ArrayList<>(exposures.size());
        int unmatched = 0;
        for (Path image : exposures) {
            String filename = image.getFileName().toString();
            Matcher matcher = EXPOSURE.matcher(filename);
            if (!matcher.lookingAt()) {
                continue;
            }
            String run = filename.substring(0, filename.indexOf('.'));
            Optional<SurveyMetadata.FieldMatch> match = runNumber(matcher.group(1)).flatMap(metadata::findField);
            if (match.isEmpty()) {
                unmatched++;
                LOG.debug("No field identifier for run {}", run);
                rows.add(new CatalogRow(run, "", "", relative(image), ""));
                continue;
            }
            SurveyMetadata.FieldMatch field = match.get();
            Path confmap = confmaps.resolve(image.getParent(), field.band());
            rows.add(new CatalogRow(run, field.fieldId(), field.band().label(), relative(image), relative(confmap)));
        }
        LOG.info("Catalogued {} exposures ({} without field identifier)", rows.size(), unmatched);
        return rows;
    }

    private static Optional<Integer> runNumber(String digits) {
        try {
            return Optional.of(Integer.parseInt(digits));
        } catch (NumberFormatException e) {
            LOG.warn("Run number {} is out of range", digits);
            return Optional.empty();
        }
    }

    public int write(Path output) {
        List<CatalogRow> rows = scan();
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
                writer.write(CatalogRow.HEADER);
                writer.newLine();
                for (CatalogRow row : rows) {
                    writer.write(row.toCsv());
                    writer.newLine();
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to write catalog: " + output, e);
        }
        return rows.size();
    }

    private List<Path> findExposures() {
        List<Path> found = new ArrayList<>();
        try {
            Files.walkFileTree(dataDir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    Path name = dir.getFileName();
                    if (!dir.equals(dataDir) && name != null && ignoredDirectories.contains(name.toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && EXPOSURE.matcher(file.getFileName().toString()).lookingAt()) {
                        found.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new RuntimeException("Failed to walk data directory: " + dataDir, e);
        }
        found.sort(Comparator.comparing(Path::toString));
        return found;
    }

    private String relative(Path path) {
        Path abs = path.toAbsolutePath().normalize();
        if (!abs.startsWith(dataDir)) {
            return abs.toString();
        }
        return dataDir.relativize(abs).toString().replace('\\', '/');
    }
}
