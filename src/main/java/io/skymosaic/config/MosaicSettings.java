package io.skymosaic.config;

import io.skymosaic.geometry.SurveyConfig;
import io.skymosaic.model.Band;
import io.skymosaic.pipeline.FailurePolicy;
import io.skymosaic.pipeline.WeightSource;
import io.skymosaic.tool.FailureRule;
import io.skymosaic.toolkit.ToolPaths;
import io.skymosaic.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolved run settings. Loaded from a JSON file whose fields are all optional;
 * anything missing falls back to {@link #defaults()}.
 */
public final class MosaicSettings {
    public static final String DEFAULT_FILE_NAME = "skymosaic.json";
    public static final double DEFAULT_OVERLAP = 0.05;
    public static final double DEFAULT_EXPANDED_OVERLAP = 0.4;
    public static final int DEFAULT_CONF_THRESHOLD = 90;
    public static final int DEFAULT_BG_MODEL_ITERATIONS = 20_000;
    public static final long DEFAULT_POLL_INTERVAL_MS = 200L;

    private final SurveyConfig survey;
    private final double overlap;
    private final double expandedOverlap;
    private final Path imageDir;
    private final Path scratchDir;
    private final Path outputDir;
    private final Path confmapDir;
    private final Path imgtableDir;
    private final Path workerInputDir;
    private final Path workerOutputDir;
    private final ToolPaths tools;
    private final int confThreshold;
    private final int bgModelIterations;
    private final WeightSource weightSource;
    private final boolean copyImages;
    private final FailurePolicy failurePolicy;
    private final FailureRule failureRule;
    private final long pollIntervalMs;
    private final Map<Band, List<String>> confmapCandidates;
    private final Map<String, String> directorySubstitutions;
    private final List<String> ignoredDirectories;

    private MosaicSettings(Builder b) {
        if (b.overlap < 0.0 || b.expandedOverlap < 0.0) {
            throw new IllegalArgumentException("overlap fractions must be >= 0");
        }
        if (b.confThreshold < 0) {
            throw new IllegalArgumentException("confThreshold must be >= 0: " + b.confThreshold);
        }
        if (b.bgModelIterations <= 0) {
            throw new IllegalArgumentException("bgModelIterations must be positive: " + b.bgModelIterations);
        }
        this.survey = b.survey;
        this.overlap = b.overlap;
        this.expandedOverlap = b.expandedOverlap;
        this.imageDir = b.imageDir;
        this.scratchDir = b.scratchDir;
        this.outputDir = b.outputDir == null ? b.scratchDir : b.outputDir;
        this.confmapDir = b.confmapDir;
        this.imgtableDir = b.imgtableDir;
        this.workerInputDir = b.workerInputDir == null ? b.imageDir : b.workerInputDir;
        this.workerOutputDir = b.workerOutputDir;
        this.tools = b.tools;
        this.confThreshold = b.confThreshold;
        this.bgModelIterations = b.bgModelIterations;
        this.weightSource = b.weightSource;
        this.copyImages = b.copyImages;
        this.failurePolicy = b.failurePolicy;
        this.failureRule = b.failureRule;
        this.pollIntervalMs = Math.max(10L, b.pollIntervalMs);
        Map<Band, List<String>> candidates = new EnumMap<>(Band.class);
        b.confmapCandidates.forEach((band, names) -> candidates.put(band, List.copyOf(names)));
        this.confmapCandidates = Map.copyOf(candidates);
        this.directorySubstitutions = Map.copyOf(b.directorySubstitutions);
        this.ignoredDirectories = List.copyOf(b.ignoredDirectories);
    }

    public static MosaicSettings defaults() {
        return new Builder().build();
    }

    /**
     * Loads settings from {@code file}; a missing file yields the defaults.
     */
    public static MosaicSettings load(Path file) {
        if (file == null || !Files.exists(file)) {
            return defaults();
        }
        try {
            SettingsFile parsed = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(parsed);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load settings: " + file, e);
        }
    }

    static MosaicSettings fromFile(SettingsFile file) {
        Builder b = new Builder();
        if (file == null) {
            return b.build();
        }
        SurveyConfig d = b.survey;
        b.survey = new SurveyConfig(
                orDefault(file.lonMin(), d.lonMin()),
                orDefault(file.lonMax(), d.lonMax()),
                orDefault(file.latMin(), d.latMin()),
                orDefault(file.latMax(), d.latMax()),
                orDefault(file.resolution(), d.resolution()),
                orDefault(file.tilesX(), d.tilesX()),
                orDefault(file.tilesY(), d.tilesY()),
                orDefault(file.ctype1(), d.ctype1()),
                orDefault(file.ctype2(), d.ctype2())
        );
        b.overlap = orDefault(file.overlap(), b.overlap);
        b.expandedOverlap = orDefault(file.expandedOverlap(), b.expandedOverlap);
        b.imageDir = pathOr(file.imageDir(), b.imageDir);
        b.scratchDir = pathOr(file.scratchDir(), b.scratchDir);
        b.outputDir = pathOr(file.outputDir(), null);
        b.confmapDir = pathOr(file.confmapDir(), b.confmapDir);
        b.imgtableDir = pathOr(file.imgtableDir(), b.imgtableDir);
        b.workerInputDir = pathOr(file.workerInputDir(), null);
        b.workerOutputDir = pathOr(file.workerOutputDir(), b.workerOutputDir);
        b.tools = new ToolPaths(
                pathOr(file.montageDir(), b.tools.montageDir()),
                pathOr(file.casutoolsDir(), b.tools.casutoolsDir()),
                pathOr(file.fpackDir(), b.tools.fpackDir())
        );
        b.confThreshold = orDefault(file.confThreshold(), b.confThreshold);
        b.bgModelIterations = orDefault(file.bgModelIterations(), b.bgModelIterations);
        b.weightSource = file.weightSource() == null ? b.weightSource : WeightSource.fromString(file.weightSource());
        b.copyImages = orDefault(file.copyImages(), b.copyImages);
        b.failurePolicy = file.failurePolicy() == null ? b.failurePolicy : FailurePolicy.fromString(file.failurePolicy());
        b.failureRule = file.failureRule() == null ? b.failureRule : FailureRule.fromString(file.failureRule());
        b.pollIntervalMs = orDefault(file.pollIntervalMs(), b.pollIntervalMs);
        if (file.confmapCandidates() != null) {
            file.confmapCandidates().forEach((band, names) -> {
                if (names != null && !names.isEmpty()) {
                    b.confmapCandidates.put(Band.fromString(band), names);
                }
            });
        }
        if (file.directorySubstitutions() != null) {
            b.directorySubstitutions = new LinkedHashMap<>(file.directorySubstitutions());
        }
        if (file.ignoredDirectories() != null) {
            b.ignoredDirectories = file.ignoredDirectories();
        }
        return b.build();
    }

    public SurveyConfig survey() {
        return survey;
    }

    public double overlap() {
        return overlap;
    }

    public double expandedOverlap() {
        return expandedOverlap;
    }

    public Path imageDir() {
        return imageDir;
    }

    public Path scratchDir() {
        return scratchDir;
    }

    public Path outputDir() {
        return outputDir;
    }

    public Path confmapDir() {
        return confmapDir;
    }

    public Path imgtableDir() {
        return imgtableDir;
    }

    /**
     * Survey-wide image table for one band, as consumed by the coverage check.
     */
    public Path surveyImageTable(Band band) {
        return imgtableDir.resolve("iphas-images-best-" + band.label() + ".tbl");
    }

    public Path masterConfidenceMap(Band band) {
        return confmapDir.resolve("masterconf-" + band.label() + "-masked.fits");
    }

    public Path workerInputDir() {
        return workerInputDir;
    }

    public Path workerOutputDir() {
        return workerOutputDir;
    }

    public ToolPaths tools() {
        return tools;
    }

    public int confThreshold() {
        return confThreshold;
    }

    public int bgModelIterations() {
        return bgModelIterations;
    }

    public WeightSource weightSource() {
        return weightSource;
    }

    public boolean copyImages() {
        return copyImages;
    }

    public FailurePolicy failurePolicy() {
        return failurePolicy;
    }

    public FailureRule failureRule() {
        return failureRule;
    }

    public long pollIntervalMs() {
        return pollIntervalMs;
    }

    public List<String> confmapCandidates(Band band) {
        return confmapCandidates.getOrDefault(band, List.of());
    }

    public Map<Band, List<String>> confmapCandidates() {
        return confmapCandidates;
    }

    public Map<String, String> directorySubstitutions() {
        return directorySubstitutions;
    }

    public List<String> ignoredDirectories() {
        return ignoredDirectories;
    }

    private static double orDefault(Double value, double fallback) {
        return value == null ? fallback : value;
    }

    private static int orDefault(Integer value, int fallback) {
        return value == null ? fallback : value;
    }

    private static long orDefault(Long value, long fallback) {
        return value == null ? fallback : value;
    }

    private static boolean orDefault(Boolean value, boolean fallback) {
        return value == null ? fallback : value;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static Path pathOr(String raw, Path fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return Paths.get(raw.trim()).toAbsolutePath().normalize();
    }

    private static Path local(String raw) {
        return Paths.get(raw).toAbsolutePath().normalize();
    }

    record SettingsFile(
            Double lonMin,
            Double lonMax,
            Double latMin,
            Double latMax,
            Double resolution,
            Integer tilesX,
            Integer tilesY,
            String ctype1,
            String ctype2,
            Double overlap,
            Double expandedOverlap,
            String imageDir,
            String scratchDir,
            String outputDir,
            String confmapDir,
            String imgtableDir,
            String workerInputDir,
            String workerOutputDir,
            String montageDir,
            String casutoolsDir,
            String fpackDir,
            Integer confThreshold,
            Integer bgModelIterations,
            String weightSource,
            Boolean copyImages,
            String failurePolicy,
            String failureRule,
            Long pollIntervalMs,
            Map<String, List<String>> confmapCandidates,
            Map<String, String> directorySubstitutions,
            List<String> ignoredDirectories
    ) {
    }

    private static final class Builder {
        private SurveyConfig survey = new SurveyConfig(
                26.5, 218.5, -6.0, 6.0, 4.0, 64, 4,
                SurveyConfig.DEFAULT_CTYPE1, SurveyConfig.DEFAULT_CTYPE2);
        private double overlap = DEFAULT_OVERLAP;
        private double expandedOverlap = DEFAULT_EXPANDED_OVERLAP;
        private Path imageDir = local("data/images");
        private Path scratchDir = local("scratch");
        private Path outputDir;
        private Path confmapDir = local("confmap");
        private Path imgtableDir = local("imgtable");
        private Path workerInputDir;
        private Path workerOutputDir = local("mosaic-out");
        private ToolPaths tools = new ToolPaths(
                Paths.get("/opt/montage/bin"),
                Paths.get("/opt/casutools/bin"),
                Paths.get("/opt/cfitsio/bin"));
        private int confThreshold = DEFAULT_CONF_THRESHOLD;
        private int bgModelIterations = DEFAULT_BG_MODEL_ITERATIONS;
        private WeightSource weightSource = WeightSource.RESAMPLED;
        private boolean copyImages = true;
        private FailurePolicy failurePolicy = FailurePolicy.CONTINUE;
        private FailureRule failureRule = FailureRule.STDERR_ONLY;
        private long pollIntervalMs = DEFAULT_POLL_INTERVAL_MS;
        private final Map<Band, List<String>> confmapCandidates = defaultConfmapCandidates();
        private Map<String, String> directorySubstitutions = defaultSubstitutions();
        private List<String> ignoredDirectories = List.of("junk", "badones", "crap", "9thoct", "Uband", "gband", "slow");

        MosaicSettings build() {
            return new MosaicSettings(this);
        }
    }

    private static Map<String, String> defaultSubstitutions() {
        Map<String, String> subs = new LinkedHashMap<>();
        subs.put("iphas_nov2006c", "iphas_nov2006b");
        subs.put("iphas_jul2008", "iphas_aug2008");
        subs.put("iphas_oct2009", "iphas_nov2009");
        subs.put("run10", "run11");
        subs.put("run13", "run12");
        return subs;
    }

    private static Map<Band, List<String>> defaultConfmapCandidates() {
        Map<Band, List<String>> out = new EnumMap<>(Band.class);
        out.put(Band.HA, List.of(
                "Ha_conf.fits", "Ha_conf.fit",
                "Halpha_conf.fit",
                "ha_conf.fits", "ha_conf.fit",
                "h_conf.fits", "h_conf.fit",
                "Halpha:197_iphas_aug2003_cpm.fit",
                "Halpha:197_iphas_sep2003_cpm.fit",
                "Halpha:197_iphas_oct2003_cpm.fit",
                "Halpha:197_iphas_nov2003_cpm.fit",
                "Halpha:197_nov2003b_cpm.fit",
                "Halpha:197_dec2003_cpm.fit",
                "Halpha:197_jun2004_cpm.fit",
                "Halpha:197_iphas_jul2004a_cpm.fit",
                "Halpha:197_iphas_jul2004_cpm.fit",
                "Halpha:197_iphas_aug2004a_cpm.fit",
                "Halpha:197_iphas_aug2004b_cpm.fit",
                "Halpha:197_iphas_dec2004b_cpm.fit"));
        out.put(Band.R, List.of(
                "r_conf.fit", "r_conf.fits",
                "r:214_iphas_aug2003_cpm.fit",
                "r:214_dec2003_cpm.fit",
                "r:214_iphas_nov2003_cpm.fit",
                "r:214_nov2003b_cpm.fit",
                "r:214_iphas_sep2003_cpm.fit",
                "r:214_iphas_aug2004a_cpm.fit",
                "r:214_iphas_aug2004b_cpm.fit",
                "r:214_iphas_jul2004a_cpm.fit",
                "r:214_iphas_jul2004_cpm.fit",
                "r:214_jun2004_cpm.fit"));
        out.put(Band.I, List.of(
                "i_conf.fit", "i_conf.fits",
                "i:215_iphas_aug2003_cpm.fit",
                "i:215_dec2003_cpm.fit",
                "i:215_iphas_nov2003_cpm.fit",
                "i:215_nov2003b_cpm.fit",
                "i:215_iphas_sep2003_cpm.fit",
                "i:215_iphas_aug2004a_cpm.fit",
                "i:215_iphas_aug2004b_cpm.fit",
                "i:215_iphas_jul2004a_cpm.fit",
                "i:215_iphas_jul2004_cpm.fit",
                "i:215_jun2004_cpm.fit"));
        return out;
    }
}
