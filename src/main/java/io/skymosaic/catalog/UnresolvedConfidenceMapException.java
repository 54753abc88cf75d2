package io.skymosaic.catalog;

import io.skymosaic.model.Band;

import java.nio.file.Path;

public final class UnresolvedConfidenceMapException extends RuntimeException {
    private final Path directory;
    private final Band band;

    public UnresolvedConfidenceMapException(Path directory, Band band) {
        super("No confidence map found in directory " + directory + " for band " + band.label());
        this.directory = directory;
        this.band = band;
    }

    public Path directory() {
        return directory;
    }

    public Band band() {
        return band;
    }
}
