package io.skymosaic.catalog;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class CatalogReader {
    private CatalogReader() {
    }

    /**
     * Reads all data rows in file order. The first line is the header and is
     * skipped; blank lines are ignored.
     */
    public static List<CatalogRow> read(Path catalog) {
        List<CatalogRow> rows = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(catalog, StandardCharsets.UTF_8)) {
            String line = reader.readLine();
            if (line == null) {
                return rows;
            }
            int lineNo = 1;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    rows.add(CatalogRow.parse(line));
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException(catalog + ":" + lineNo + ": " + e.getMessage(), e);
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to read catalog: " + catalog, e);
        }
        return rows;
    }
}
