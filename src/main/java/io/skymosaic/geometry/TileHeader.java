package io.skymosaic.geometry;

import java.util.Locale;

/**
 * Projection description of one tile. Extents are kept as computed; pixel
 * counts are rounded only when rendered.
 */
public record TileHeader(
        double naxis1,
        double naxis2,
        String ctype1,
        String ctype2,
        double crval1,
        double crval2,
        double crpix1,
        double crpix2,
        double cdelt1,
        double cdelt2
) {
    public long naxis1Pixels() {
        return Math.round(naxis1);
    }

    public long naxis2Pixels() {
        return Math.round(naxis2);
    }

    /**
     * Renders the header in the fixed keyword order the Montage tools read.
     */
    public String toText() {
        StringBuilder sb = new StringBuilder(512);
        line(sb, "SIMPLE  = T");
        line(sb, "BITPIX  = -32");
        line(sb, "NAXIS   = 2");
        line(sb, "NAXIS1  = " + naxis1Pixels());
        line(sb, "NAXIS2  = " + naxis2Pixels());
        line(sb, "CTYPE1  = '" + ctype1 + "'");
        line(sb, "CTYPE2  = '" + ctype2 + "'");
        line(sb, "EQUINOX = 2000");
        line(sb, String.format(Locale.ROOT, "CRVAL1  =  %.7f", crval1));
        line(sb, String.format(Locale.ROOT, "CRVAL2  =   %.7f", crval2));
        line(sb, String.format(Locale.ROOT, "CRPIX1  =   %.7f", crpix1));
        line(sb, String.format(Locale.ROOT, "CRPIX2  =   %.7f", crpix2));
        line(sb, String.format(Locale.ROOT, "CDELT1  =    %.14f", cdelt1));
        line(sb, String.format(Locale.ROOT, "CDELT2  =    %.14f", cdelt2));
        line(sb, "PC1_1 = 1");
        line(sb, "PC1_2 = 0");
        line(sb, "PC2_1 = 0");
        line(sb, "PC2_2 = 1");
        line(sb, "END");
        return sb.toString();
    }

    private static void line(StringBuilder sb, String card) {
        sb.append(card).append('\n');
    }
}
