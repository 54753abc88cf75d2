package io.skymosaic.catalog;

import io.skymosaic.model.Band;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Observation log exported as CSV with an {@code id} column and one
 * {@code run_<band>} column per band. Bands are searched in r, i, ha order.
 */
public final class CsvSurveyMetadata implements SurveyMetadata {
    private static final List<Band> SEARCH_ORDER = List.of(Band.R, Band.I, Band.HA);

    private final Map<Band, Map<Integer, String>> fieldsByRun;

    private CsvSurveyMetadata(Map<Band, Map<Integer, String>> fieldsByRun) {
        this.fieldsByRun = fieldsByRun;
    }

    public static CsvSurveyMetadata load(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read survey metadata: " + file, e);
        }
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("Survey metadata is empty: " + file);
        }
        List<String> header = new ArrayList<>();
        for (String col : lines.get(0).split(",", -1)) {
            header.add(col.trim().toLowerCase(Locale.ROOT));
        }
        int idCol = header.indexOf("id");
        if (idCol < 0) {
            throw new IllegalArgumentException("Survey metadata has no 'id' column: " + file);
        }
        Map<Band, Integer> runCols = new EnumMap<>(Band.class);
        for (Band band : Band.values()) {
            int col = header.indexOf("run_" + band.label());
            if (col >= 0) {
                runCols.put(band, col);
            }
        }
        Map<Band, Map<Integer, String>> index = new EnumMap<>(Band.class);
        for (Band band : Band.values()) {
            index.put(band, new HashMap<>());
        }
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            String[] cols = line.split(",", -1);
            String id = idCol < cols.length ? cols[idCol].trim() : "";
            if (id.isEmpty()) {
                continue;
            }
            for (Map.Entry<Band, Integer> entry : runCols.entrySet()) {
                int col = entry.getValue();
                if (col >= cols.length || cols[col].isBlank()) {
                    continue;
                }
                try {
                    index.get(entry.getKey()).putIfAbsent(Integer.parseInt(cols[col].trim()), id);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException(file + ":" + (i + 1) + ": bad run number '" + cols[col] + "'", e);
                }
            }
        }
        return new CsvSurveyMetadata(index);
    }

    @Override
    public Optional<FieldMatch> findField(int runNumber) {
        for (Band band : SEARCH_ORDER) {
            String id = fieldsByRun.get(band).get(runNumber);
            if (id != null) {
                return Optional.of(new FieldMatch(id, band));
            }
        }
        return Optional.empty();
    }
}
