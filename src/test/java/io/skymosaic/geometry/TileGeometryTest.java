package io.skymosaic.geometry;

import io.skymosaic.model.Band;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

final class TileGeometryTest {
    private static final SurveyConfig SURVEY = new SurveyConfig(
            26.5, 218.5, -6.0, 6.0, 4.0, 64, 4, "GLON-CAR", "GLAT-CAR");

    @Test
    void headerTextIsDeterministic() {
        TileGeometry geometry = new TileGeometry(SURVEY);
        String first = geometry.computeHeader(150, 0.05).toText();
        String second = new TileGeometry(SURVEY).computeHeader(150, 0.05).toText();
        Assertions.assertEquals(first, second);
    }

    @Test
    void surveyDefaultsGiveThreeDegreeTilesOf2970Pixels() {
        TileGeometry geometry = new TileGeometry(SURVEY);
        Assertions.assertEquals(3.0, SURVEY.tileWidthDeg(), 1e-12);

        TileHeader base = geometry.computeHeader(0, 0.0);
        Assertions.assertEquals(-4.0 / 3600.0, base.cdelt1(), 1e-15);
        Assertions.assertEquals(2700L, base.naxis1Pixels());

        TileHeader normal = geometry.computeHeader(0, 0.05);
        Assertions.assertEquals(2970L, normal.naxis1Pixels());
        Assertions.assertEquals(2970L, normal.naxis2Pixels());
    }

    @Test
    void tile150SitsInColumn37Row2() {
        TileGeometry geometry = new TileGeometry(SURVEY);
        Tile tile = geometry.tile(150);
        Assertions.assertEquals(37, tile.x());
        Assertions.assertEquals(2, tile.y());

        List<String> lines = geometry.computeHeader(150, 0.05).toText().lines().toList();
        Assertions.assertEquals(List.of(
                "SIMPLE  = T",
                "BITPIX  = -32",
                "NAXIS   = 2",
                "NAXIS1  = 2970",
                "NAXIS2  = 2970",
                "CTYPE1  = 'GLON-CAR'",
                "CTYPE2  = 'GLAT-CAR'",
                "EQUINOX = 2000",
                "CRVAL1  =  139.0000000",
                "CRVAL2  =   1.5000000",
                "CRPIX1  =   1485.0000000",
                "CRPIX2  =   1485.0000000",
                "CDELT1  =    -0.00111111111111",
                "CDELT2  =    0.00111111111111",
                "PC1_1 = 1",
                "PC1_2 = 0",
                "PC2_1 = 0",
                "PC2_2 = 1",
                "END"
        ), lines);
    }

    @Test
    void rejectsTileIndexOutsideGrid() {
        TileGeometry geometry = new TileGeometry(SURVEY);
        OutOfRangeTileException high = Assertions.assertThrows(OutOfRangeTileException.class,
                () -> geometry.computeHeader(256, 0.05));
        Assertions.assertEquals(256, high.tileIndex());
        Assertions.assertEquals(256, high.tileCount());
        Assertions.assertThrows(OutOfRangeTileException.class, () -> geometry.tile(-1));
        Assertions.assertThrows(IllegalArgumentException.class, () -> geometry.computeHeader(0, -0.1));
    }

    @Test
    void overlapScalesPixelExtentsOnly() {
        TileGeometry geometry = new TileGeometry(SURVEY);
        for (int index : new int[]{0, 3, 150, 255}) {
            TileHeader base = geometry.computeHeader(index, 0.0);
            for (double overlap : new double[]{0.05, 0.4, 1.0}) {
                TileHeader scaled = geometry.computeHeader(index, overlap);
                Assertions.assertEquals((1 + 2 * overlap) * base.naxis1(), scaled.naxis1(), 1e-9);
                Assertions.assertEquals((1 + 2 * overlap) * base.naxis2(), scaled.naxis2(), 1e-9);
                Assertions.assertEquals(base.crval1(), scaled.crval1(), 0.0);
                Assertions.assertEquals(base.crval2(), scaled.crval2(), 0.0);
                Assertions.assertEquals(scaled.naxis1() / 2.0, scaled.crpix1(), 0.0);
            }
        }
    }

    @Test
    void tilesCoverTheSurveyExactlyOnce() {
        SurveyConfig odd = new SurveyConfig(10.0, 17.0, -2.0, 1.0, 2.0, 7, 3, null, null);
        TileGeometry geometry = new TileGeometry(odd);
        Set<String> cells = new HashSet<>();
        double area = 0.0;
        for (int i = 0; i < odd.tileCount(); i++) {
            Tile tile = geometry.tile(i);
            Assertions.assertTrue(tile.x() >= 0 && tile.x() < odd.tilesX());
            Assertions.assertTrue(tile.y() >= 0 && tile.y() < odd.tilesY());
            Assertions.assertTrue(cells.add(tile.x() + ":" + tile.y()), "cell visited twice: " + i);
            Assertions.assertEquals(i, tile.x() * odd.tilesY() + tile.y());
            area += (tile.lonMax() - tile.lonMin()) * (tile.latMax() - tile.latMin());
        }
        Assertions.assertEquals(odd.tilesX() * odd.tilesY(), cells.size());
        Assertions.assertEquals((17.0 - 10.0) * (1.0 - -2.0), area, 1e-9);

        Assertions.assertEquals(10.0, geometry.tile(0).lonMin(), 1e-12);
        Assertions.assertEquals(-2.0, geometry.tile(0).latMin(), 1e-12);
        Tile last = geometry.tile(odd.tileCount() - 1);
        Assertions.assertEquals(17.0, last.lonMax(), 1e-12);
        Assertions.assertEquals(1.0, last.latMax(), 1e-12);
        for (int i = 0; i + 1 < odd.tileCount(); i++) {
            Tile a = geometry.tile(i);
            Tile b = geometry.tile(i + 1);
            if (a.x() == b.x()) {
                Assertions.assertEquals(a.latMax(), b.latMin(), 1e-12);
            } else {
                Assertions.assertEquals(a.lonMax(), b.lonMin(), 1e-12);
            }
        }
    }

    @Test
    void writesNormalAndExpandedHeaders() throws Exception {
        Path dir = Files.createTempDirectory("skymosaic-headers-");
        try {
            TileGeometry geometry = new TileGeometry(SURVEY);
            TileGeometry.HeaderFiles files = geometry.writeHeaders(150, Band.HA, 0.05, 0.4, dir);

            Assertions.assertEquals("tile150-ha-normal", files.name());
            Assertions.assertEquals(dir.resolve("tile150-ha-normal.hdr"), files.normal());
            Assertions.assertEquals(dir.resolve("tile150-ha-normal.hdr.expanded"), files.expanded());
            String expanded = Files.readString(files.expanded(), StandardCharsets.US_ASCII);
            Assertions.assertTrue(expanded.contains("NAXIS1  = 4860\n"));
            Assertions.assertTrue(expanded.contains("CRVAL1  =  139.0000000\n"));
            Assertions.assertEquals(geometry.computeHeader(150, 0.05).toText(),
                    Files.readString(files.normal(), StandardCharsets.US_ASCII));
        } finally {
            deleteRecursively(dir);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
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
