package io.skymosaic.config;

import io.skymosaic.model.Band;
import io.skymosaic.pipeline.FailurePolicy;
import io.skymosaic.pipeline.WeightSource;
import io.skymosaic.tool.FailureRule;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class MosaicSettingsTest {

    @Test
    void missingFileYieldsSurveyDefaults() {
        MosaicSettings settings = MosaicSettings.load(Path.of("does-not-exist-skymosaic.json"));

        Assertions.assertEquals(26.5, settings.survey().lonMin());
        Assertions.assertEquals(218.5, settings.survey().lonMax());
        Assertions.assertEquals(64, settings.survey().tilesX());
        Assertions.assertEquals(4, settings.survey().tilesY());
        Assertions.assertEquals(4.0, settings.survey().resolution());
        Assertions.assertEquals(0.05, settings.overlap());
        Assertions.assertEquals(0.4, settings.expandedOverlap());
        Assertions.assertEquals("GLON-CAR", settings.survey().ctype1());
        Assertions.assertEquals(90, settings.confThreshold());
        Assertions.assertEquals(20000, settings.bgModelIterations());
        Assertions.assertEquals(WeightSource.RESAMPLED, settings.weightSource());
        Assertions.assertEquals(FailurePolicy.CONTINUE, settings.failurePolicy());
        Assertions.assertEquals(FailureRule.STDERR_ONLY, settings.failureRule());
        Assertions.assertEquals(settings.scratchDir(), settings.outputDir());
        Assertions.assertEquals(settings.imageDir(), settings.workerInputDir());
        Assertions.assertEquals("run12", settings.directorySubstitutions().get("run13"));
        Assertions.assertTrue(settings.ignoredDirectories().contains("junk"));
        Assertions.assertTrue(settings.confmapCandidates(Band.HA).contains("ha_conf.fit"));
    }

    @Test
    void fileOverridesOnlyTheFieldsItNames() throws Exception {
        Path dir = Files.createTempDirectory("skymosaic-settings-");
        Path file = dir.resolve(MosaicSettings.DEFAULT_FILE_NAME);
        try {
            Files.writeString(file, """
                    {
                      "tilesX": 8,
                      "overlap": 0.1,
                      "scratchDir": "%s",
                      "montageDir": "/usr/local/montage/bin",
                      "failurePolicy": "halt",
                      "failureRule": "stderr-or-exit-code",
                      "confmapCandidates": {"r": ["r_conf_v2.fit"]},
                      "ignoredDirectories": ["skip"],
                      "someFutureSetting": true
                    }
                    """.formatted(dir.resolve("scratch")), StandardCharsets.UTF_8);

            MosaicSettings settings = MosaicSettings.load(file);

            Assertions.assertEquals(8, settings.survey().tilesX());
            Assertions.assertEquals(4, settings.survey().tilesY());
            Assertions.assertEquals(0.1, settings.overlap());
            Assertions.assertEquals(dir.resolve("scratch"), settings.scratchDir());
            Assertions.assertEquals(dir.resolve("scratch"), settings.outputDir());
            Assertions.assertEquals(Path.of("/usr/local/montage/bin"), settings.tools().montageDir());
            Assertions.assertEquals(Path.of("/opt/casutools/bin"), settings.tools().casutoolsDir());
            Assertions.assertEquals(FailurePolicy.HALT, settings.failurePolicy());
            Assertions.assertEquals(FailureRule.STDERR_OR_EXIT_CODE, settings.failureRule());
            Assertions.assertEquals(List.of("r_conf_v2.fit"), settings.confmapCandidates(Band.R));
            Assertions.assertFalse(settings.confmapCandidates(Band.HA).isEmpty());
            Assertions.assertEquals(List.of("skip"), settings.ignoredDirectories());
        } finally {
            Files.deleteIfExists(file);
            Files.deleteIfExists(dir);
        }
    }

    @Test
    void invalidSurveyBoundsFailFast() throws Exception {
        Path dir = Files.createTempDirectory("skymosaic-settings-bad-");
        Path file = dir.resolve("bad.json");
        try {
            Files.writeString(file, "{\"lonMin\": 100, \"lonMax\": 50}", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> MosaicSettings.load(file));

            Files.writeString(file, "{\"expandedOverlap\": -0.2}", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> MosaicSettings.load(file));

            Files.writeString(file, "{\"weightSource\": \"bogus\"}", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> MosaicSettings.load(file));
        } finally {
            Files.deleteIfExists(file);
            Files.deleteIfExists(dir);
        }
    }

    @Test
    void dispatchLayoutSanitizesWorkerIds() {
        DispatchLayout layout = new DispatchLayout(Path.of("/srv/dispatch"));
        Assertions.assertEquals("node-7", DispatchLayout.sanitizeWorkerId(" Node 7 "));
        Assertions.assertEquals("w.hidden", DispatchLayout.sanitizeWorkerId(".hidden"));
        Assertions.assertEquals(Path.of("/srv/dispatch/replies/w1"), layout.replyDir("W1"));
        Assertions.assertEquals(Path.of("/srv/dispatch/journal/dispatch.log"), layout.journalFile());
        Assertions.assertThrows(IllegalArgumentException.class, () -> DispatchLayout.sanitizeWorkerId(" "));
    }
}
