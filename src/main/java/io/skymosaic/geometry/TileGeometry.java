package io.skymosaic.geometry;

import io.skymosaic.model.Band;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Partitions the survey region into an {@code tilesX * tilesY} grid and derives
 * the projection header of each tile.
 *
 * <p>Tiles are numbered column-major: {@code x = index / tilesY},
 * {@code y = index % tilesY}. Every call recomputes the full geometry from the
 * configuration, so headers for the same tile at different overlaps stay
 * consistent with each other.
 */
public final class TileGeometry {
    private static final Logger LOG = LoggerFactory.getLogger(TileGeometry.class);

    private final SurveyConfig config;

    public TileGeometry(SurveyConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("survey config cannot be null");
        }
        this.config = config;
    }

    public SurveyConfig config() {
        return config;
    }

    public Tile tile(int tileIndex) {
        int count = config.tileCount();
        if (tileIndex < 0 || tileIndex >= count) {
            throw new OutOfRangeTileException(tileIndex, count);
        }
        int x = Math.floorDiv(tileIndex, config.tilesY());
        int y = Math.floorMod(tileIndex, config.tilesY());
        double width = config.tileWidthDeg();
        double height = config.tileHeightDeg();
        return new Tile(
                tileIndex,
                x,
                y,
                config.lonMin() + x * width,
                config.lonMin() + (x + 1) * width,
                config.latMin() + y * height,
                config.latMin() + (y + 1) * height
        );
    }

    public TileHeader computeHeader(int tileIndex, double overlapFraction) {
        if (overlapFraction < 0.0 || Double.isNaN(overlapFraction)) {
            throw new IllegalArgumentException("overlap fraction must be >= 0: " + overlapFraction);
        }
        Tile tile = tile(tileIndex);

        double cdelt1 = -config.resolution() / 3600.0;
        double cdelt2 = config.resolution() / 3600.0;

        double width = config.tileWidthDeg();
        double height = config.tileHeightDeg();
        double naxis1 = (1.0 + 2.0 * overlapFraction) * (width / -cdelt1);
        double naxis2 = (1.0 + 2.0 * overlapFraction) * (height / cdelt2);

        double crval1 = config.lonMin() + (tile.x() + 0.5) * width;
        double crval2 = config.latMin() + (tile.y() + 0.5) * height;
        double crpix1 = naxis1 / 2.0;
        double crpix2 = naxis2 / 2.0;

        LOG.debug("Tile {}: x={} y={} NAXIS1={} NAXIS2={} CRVAL1={} CRVAL2={} CDELT1={} CDELT2={}",
                tileIndex, tile.x(), tile.y(), naxis1, naxis2, crval1, crval2, cdelt1, cdelt2);

        return new TileHeader(
                naxis1,
                naxis2,
                config.ctype1(),
                config.ctype2(),
                crval1,
                crval2,
                crpix1,
                crpix2,
                cdelt1,
                cdelt2
        );
    }

    /**
     * Writes the normal and expanded headers of a tile next to each other as
     * {@code <dir>/<name>.hdr} and {@code <dir>/<name>.hdr.expanded}.
     */
    public HeaderFiles writeHeaders(int tileIndex, Band band, double overlap, double expandedOverlap, Path dir) {
        String name = Tile.mosaicName(tileIndex, band);
        Path normal = dir.resolve(name + ".hdr");
        Path expanded = dir.resolve(name + ".hdr.expanded");
        try {
            Files.createDirectories(dir);
            Files.writeString(normal, computeHeader(tileIndex, overlap).toText(), StandardCharsets.US_ASCII);
            Files.writeString(expanded, computeHeader(tileIndex, expandedOverlap).toText(), StandardCharsets.US_ASCII);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write headers for " + name + " into " + dir, e);
        }
        return new HeaderFiles(name, normal, expanded);
    }

    public record HeaderFiles(String name, Path normal, Path expanded) {
    }
}
