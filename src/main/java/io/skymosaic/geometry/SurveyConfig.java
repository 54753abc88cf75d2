package io.skymosaic.geometry;

/**
 * Survey-wide tiling parameters. Longitudes and latitudes are in degrees,
 * resolution in arcsec per pixel.
 */
public record SurveyConfig(
        double lonMin,
        double lonMax,
        double latMin,
        double latMax,
        double resolution,
        int tilesX,
        int tilesY,
        String ctype1,
        String ctype2
) {
    public static final String DEFAULT_CTYPE1 = "GLON-CAR";
    public static final String DEFAULT_CTYPE2 = "GLAT-CAR";

    public SurveyConfig {
        if (!(lonMax > lonMin)) {
            throw new IllegalArgumentException("lonMax must be greater than lonMin: " + lonMin + ".." + lonMax);
        }
        if (!(latMax > latMin)) {
            throw new IllegalArgumentException("latMax must be greater than latMin: " + latMin + ".." + latMax);
        }
        if (!(resolution > 0.0)) {
            throw new IllegalArgumentException("resolution must be positive: " + resolution);
        }
        if (tilesX <= 0 || tilesY <= 0) {
            throw new IllegalArgumentException("tile counts must be positive: " + tilesX + "x" + tilesY);
        }
        ctype1 = ctype1 == null || ctype1.isBlank() ? DEFAULT_CTYPE1 : ctype1.trim();
        ctype2 = ctype2 == null || ctype2.isBlank() ? DEFAULT_CTYPE2 : ctype2.trim();
    }

    public int tileCount() {
        return tilesX * tilesY;
    }

    public double tileWidthDeg() {
        return (lonMax - lonMin) / tilesX;
    }

    public double tileHeightDeg() {
        return (latMax - latMin) / tilesY;
    }
}
