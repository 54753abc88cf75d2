package io.skymosaic.observability;

import io.skymosaic.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines record of dispatch decisions and job outcomes. Several
 * processes may append to the same file; each row is written with a single
 * append.
 */
public final class RunJournal {
    private final Path journalFile;

    public RunJournal(Path journalFile) {
        this.journalFile = journalFile;
        try {
            Files.createDirectories(journalFile.getParent());
            if (!Files.exists(journalFile)) {
                try {
                    Files.createFile(journalFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize journal file: " + journalFile, e);
        }
    }

    public Path journalFile() {
        return journalFile;
    }

    public synchronized void log(Event event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", event.details());
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(journalFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write journal row", e);
        }
    }

    /**
     * Rows with the given action, oldest first.
     */
    public List<Map<String, Object>> read(String action) {
        List<Map<String, Object>> out = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(journalFile, StandardCharsets.UTF_8)) {
                if (line == null || line.isBlank()) {
                    continue;
                }
                @SuppressWarnings("unchecked")
                Map<String, Object> row = Jsons.fromJson(line, Map.class);
                if (action == null || action.equals(row.get("action"))) {
                    out.add(row);
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to read journal: " + journalFile, e);
        }
        return out;
    }

    public record Event(
            String action,
            String actor,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static Event of(String action, String actor, String resource, String result, Map<String, Object> details) {
            return new Event(action, actor, resource, result, details == null ? Map.of() : details);
        }
    }
}
