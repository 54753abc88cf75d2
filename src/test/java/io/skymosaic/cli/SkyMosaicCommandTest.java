package io.skymosaic.cli;

import io.skymosaic.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class SkyMosaicCommandTest {

    @Test
    void headerPrintsTheProjectionOfOneTile() {
        Invocation result = execute("--config", "does-not-exist.json", "header", "--tile", "150");

        Assertions.assertEquals(0, result.exitCode());
        Assertions.assertTrue(result.stdout().startsWith("SIMPLE  = T\n"), result.stdout());
        Assertions.assertTrue(result.stdout().contains("NAXIS1  = 2970\n"), result.stdout());
        Assertions.assertTrue(result.stdout().contains("CRVAL1  =  139.0000000\n"), result.stdout());
        Assertions.assertTrue(result.stdout().endsWith("END\n"), result.stdout());
    }

    @Test
    void headerRejectsTileOutsideTheGrid() {
        Invocation result = execute("--config", "does-not-exist.json", "header", "--tile", "999");
        Assertions.assertNotEquals(0, result.exitCode());
    }

    @Test
    void catalogWritesRowsAndReportsCounts() throws Exception {
        Path root = Files.createTempDirectory("skymosaic-cli-catalog-");
        try {
            Path data = root.resolve("data");
            touch(data.resolve("run12/r000200.fit"));
            touch(data.resolve("run12/r_conf.fit"));
            Path metadata = root.resolve("observations.csv");
            Files.writeString(metadata, "id,run_r,run_i,run_ha\nISWC002,200,201,202\n", StandardCharsets.UTF_8);
            Path out = root.resolve("catalog.csv");

            Invocation result = execute("--config", root.resolve("none.json").toString(), "catalog",
                    "--data", data.toString(), "--metadata", metadata.toString(), "--out", out.toString());

            Assertions.assertEquals(0, result.exitCode());
            Map<String, Object> summary = result.json();
            Assertions.assertEquals(1, summary.get("rows"));
            Assertions.assertEquals(1, summary.get("confidenceMaps"));
            Assertions.assertEquals(List.of(
                    "run,field,filter,image,confmap",
                    "r000200,ISWC002,r,run12/r000200.fit,run12/r_conf.fit"
            ), Files.readAllLines(out, StandardCharsets.UTF_8));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void localRunAssignsEveryJobEvenWhenToolsAreMissing() throws Exception {
        Path root = Files.createTempDirectory("skymosaic-cli-local-");
        try {
            Path config = writeSettings(root);
            Path catalog = root.resolve("catalog.csv");
            Files.writeString(catalog, String.join("\n",
                    "run,field,filter,image,confmap",
                    "r1,F1,ha,n1/r1.fit,n1/ha_conf.fit",
                    "r2,F2,r,n1/r2.fit,n1/r_conf.fit",
                    "r3,,,n1/r3.fit,",
                    ""), StandardCharsets.UTF_8);

            Invocation result = execute("--config", config.toString(), "local",
                    "--catalog", catalog.toString(), "--workers", "2", "--root", root.resolve("dispatch").toString());

            Assertions.assertEquals(0, result.exitCode(), result.stdout());
            Map<String, Object> summary = result.json();
            @SuppressWarnings("unchecked")
            Map<String, Object> dispatch = (Map<String, Object>) summary.get("dispatch");
            Assertions.assertEquals(2, dispatch.get("jobsAssigned"));
            Assertions.assertEquals(2, dispatch.get("shutdownsSent"));
            @SuppressWarnings("unchecked")
            List<Map<String, Object>> workers = (List<Map<String, Object>>) summary.get("workers");
            int received = 0;
            int succeeded = 0;
            for (Map<String, Object> worker : workers) {
                received += (Integer) worker.get("jobsReceived");
                succeeded += (Integer) worker.get("jobsSucceeded");
            }
            Assertions.assertEquals(2, received);
            Assertions.assertEquals(0, succeeded);
            Assertions.assertTrue(Files.exists(root.resolve("dispatch").resolve("journal").resolve("dispatch.log")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void tileRunExitsNonZeroWhenToolsAreMissing() throws Exception {
        Path root = Files.createTempDirectory("skymosaic-cli-tile-");
        try {
            Path config = writeSettings(root);

            Invocation result = execute("--config", config.toString(), "tile", "--tile", "150", "--band", "ha");

            Assertions.assertEquals(1, result.exitCode(), result.stdout());
            Map<String, Object> summary = result.json();
            Assertions.assertEquals("tile150-ha-normal", summary.get("tile"));
            @SuppressWarnings("unchecked")
            Map<String, Object> stages = (Map<String, Object>) summary.get("stages");
            Assertions.assertEquals("OK", stages.get("workdir"));
            Assertions.assertEquals("FAILED", stages.get("select"));
            Assertions.assertNull(summary.get("haltedAt"));
            Assertions.assertTrue(Files.exists(root.resolve("scratch").resolve("tile150-ha-normal.hdr")));
        } finally {
            deleteRecursively(root);
        }
    }

    private static Path writeSettings(Path root) throws IOException {
        Path missing = root.resolve("no-such-toolkit");
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("imageDir", root.resolve("images").toString());
        json.put("scratchDir", root.resolve("scratch").toString());
        json.put("outputDir", root.resolve("out").toString());
        json.put("confmapDir", root.resolve("confmap").toString());
        json.put("imgtableDir", root.resolve("imgtable").toString());
        json.put("workerOutputDir", root.resolve("resampled").toString());
        json.put("montageDir", missing.toString());
        json.put("casutoolsDir", missing.toString());
        json.put("fpackDir", missing.toString());
        Path file = root.resolve("skymosaic.json");
        Files.writeString(file, Jsons.toJson(json), StandardCharsets.UTF_8);
        return file;
    }

    private static Invocation execute(String... args) {
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        int exitCode;
        try (PrintStream capture = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            System.setOut(capture);
            exitCode = new CommandLine(new SkyMosaicCommand()).execute(args);
        } finally {
            System.setOut(original);
        }
        return new Invocation(exitCode, buffer.toString(StandardCharsets.UTF_8));
    }

    private static void touch(Path file) throws IOException {
        Files.createDirectories(file.getParent());
        Files.write(file, new byte[0]);
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

    private record Invocation(int exitCode, String stdout) {
        @SuppressWarnings("unchecked")
        Map<String, Object> json() {
            return Jsons.fromJson(stdout.trim(), Map.class);
        }
    }
}
