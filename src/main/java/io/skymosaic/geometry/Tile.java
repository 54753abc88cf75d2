package io.skymosaic.geometry;

import io.skymosaic.model.Band;

import java.util.Locale;

/**
 * One cell of the output grid. Bounds are the core footprint, without overlap.
 */
public record Tile(
        int index,
        int x,
        int y,
        double lonMin,
        double lonMax,
        double latMin,
        double latMax
) {
    public String mosaicName(Band band) {
        return mosaicName(index, band);
    }

    public static String mosaicName(int index, Band band) {
        return String.format(Locale.ROOT, "tile%03d-%s-normal", index, band.label());
    }
}
