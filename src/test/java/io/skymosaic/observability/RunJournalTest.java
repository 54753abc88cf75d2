package io.skymosaic.observability;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

final class RunJournalTest {

    @Test
    void appendsOneJsonObjectPerLine() throws Exception {
        Path dir = Files.createTempDirectory("skymosaic-journal-");
        Path file = dir.resolve("journal").resolve("dispatch.log");
        try {
            RunJournal journal = new RunJournal(file);
            journal.log(RunJournal.Event.of("job.assign", "w1", "F1_ha", "ok", Map.of("run", "r1")));
            journal.log(RunJournal.Event.of("worker.shutdown", "master", "w1", "ok", null));
            journal.log(RunJournal.Event.of("job.assign", "w2", "F2_ha", "ok", Map.of("run", "r2")));

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            Assertions.assertEquals(3, lines.size());
            Assertions.assertTrue(lines.get(0).startsWith("{\"timestamp\":"));

            List<Map<String, Object>> assigned = journal.read("job.assign");
            Assertions.assertEquals(2, assigned.size());
            Assertions.assertEquals("F2_ha", assigned.get(1).get("resource"));
            Assertions.assertEquals(Map.of("run", "r1"), assigned.get(0).get("details"));
            Assertions.assertEquals(3, journal.read(null).size());

            RunJournal reopened = new RunJournal(file);
            Assertions.assertEquals(3, reopened.read(null).size());
        } finally {
            Files.deleteIfExists(file);
            Files.deleteIfExists(file.getParent());
            Files.deleteIfExists(dir);
        }
    }
}
