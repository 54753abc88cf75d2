package io.skymosaic.catalog;

import io.skymosaic.model.Job;

import java.util.Optional;

/**
 * One row of the image catalog: {@code run,field,filter,image,confmap}. Image
 * and confidence-map paths are relative to the raw data directory.
 */
public record CatalogRow(
        String run,
        String field,
        String filter,
        String image,
        String confmap
) {
    public static final String HEADER = "run,field,filter,image,confmap";

    public CatalogRow {
        run = clean(run);
        field = clean(field);
        filter = clean(filter);
        image = clean(image);
        confmap = clean(confmap);
    }

    public static CatalogRow parse(String line) {
        String[] cols = line.strip().split(",", -1);
        if (cols.length < 5) {
            throw new IllegalArgumentException("Catalog row needs 5 columns: " + line);
        }
        return new CatalogRow(cols[0], cols[1], cols[2], cols[3], cols[4]);
    }

    /**
     * A row without a field identifier belongs to an exposure that could not be
     * matched against survey metadata.
     */
    public boolean usable() {
        return !field.isEmpty();
    }

    public Optional<Job> toJob() {
        if (!usable() || filter.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Job.of(run, field, filter, image, confmap));
    }

    public String toCsv() {
        return String.join(",", run, field, filter, image, confmap);
    }

    private static String clean(String raw) {
        return raw == null ? "" : raw.trim();
    }
}
