package io.skymosaic.pipeline;

import io.skymosaic.config.MosaicSettings;
import io.skymosaic.geometry.TileGeometry;
import io.skymosaic.geometry.TileGeometry.HeaderFiles;
import io.skymosaic.model.Band;
import io.skymosaic.observability.TileLogScope;
import io.skymosaic.tool.ExternalToolRunner;
import io.skymosaic.tool.ToolCommand;
import io.skymosaic.tool.ToolResult;
import io.skymosaic.toolkit.CompressionCommands;
import io.skymosaic.toolkit.MontageCommands;
import io.skymosaic.toolkit.ResampleCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds one tile mosaic by driving the Montage stages over a per-tile working
 * directory.
 *
 * <p>Within a stage every command is attempted even after an earlier one
 * failed; the stage then reports FAILED with the failed results. Whether later
 * stages still run is decided by the {@link FailurePolicy}.
 */
public final class StageSequencer {
    private static final Logger LOG = LoggerFactory.getLogger(StageSequencer.class);

    private final MosaicSettings settings;
    private final ExternalToolRunner runner;
    private final TileGeometry geometry;
    private final MontageCommands montage;
    private final ResampleCommands resample;
    private final CompressionCommands compression;

    public StageSequencer(MosaicSettings settings, ExternalToolRunner runner) {
        this.settings = settings;
        this.runner = runner;
        this.geometry = new TileGeometry(settings.survey());
        this.montage = new MontageCommands(settings.tools());
        this.resample = new ResampleCommands(settings.tools());
        this.compression = new CompressionCommands(settings.tools());
    }

    public PipelineRun run(int tileIndex, Band band) {
        return run(tileIndex, band, Stage.WORKDIR_SETUP, false);
    }

    /**
     * Runs the stages from {@code from} onwards; earlier stages are recorded as
     * SKIPPED. With {@code clearIntermediate} the {@code diff/} and
     * {@code corr/} directories are emptied first.
     */
    public PipelineRun run(int tileIndex, Band band, Stage from, boolean clearIntermediate) {
        geometry.tile(tileIndex);
        Stage start = from == null ? Stage.WORKDIR_SETUP : from;
        try {
            Files.createDirectories(settings.outputDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to create output directory " + settings.outputDir(), e);
        }

        HeaderFiles headers = geometry.writeHeaders(tileIndex, band,
                settings.overlap(), settings.expandedOverlap(), settings.scratchDir());
        WorkingDirectory work = WorkingDirectory.of(settings.scratchDir(), headers.name());
        PipelineRun run = new PipelineRun(headers.name(), band, settings.failurePolicy());

        try (TileLogScope ignored = TileLogScope.open(headers.name(), settings.outputDir())) {
            LOG.info("Mosaicking {} from stage {} ({} policy)", headers.name(), start, run.policy());
            if (clearIntermediate) {
                work.clearIntermediate();
            }
            TileState state = new TileState(tileIndex, band, headers, work);
            for (Stage stage : Stage.values()) {
                if (run.isHalted()) {
                    run.record(StageResult.skipped(stage, "halted after " + run.haltedAt().orElse(null)));
                    continue;
                }
                if (stage.ordinal() < start.ordinal()) {
                    run.record(StageResult.skipped(stage, "resumed from " + start));
                    continue;
                }
                if (stage == Stage.IMAGE_COPY && !settings.copyImages()) {
                    run.record(StageResult.skipped(stage, "image copy disabled"));
                    continue;
                }
                LOG.info("Stage {}", stage);
                StageResult result = execute(stage, state);
                run.record(result);
                if (result.isFailed()) {
                    LOG.error("Stage {} failed: {}", stage, result.message());
                    if (run.policy() == FailurePolicy.HALT) {
                        run.haltAt(stage);
                    }
                }
            }
            if (run.succeeded()) {
                LOG.info("All is said and done.");
            } else {
                LOG.warn("{} finished with {} failed stage(s)", headers.name(), run.failures().size());
            }
        }
        return run;
    }

    private StageResult execute(Stage stage, TileState state) {
        try {
            return switch (stage) {
                case WORKDIR_SETUP -> setupWorkdir(state);
                case IMAGE_SELECTION -> selectImages(state);
                case IMAGE_COPY -> copyImages(state);
                case PROJECTION -> computeProjections(state);
                case OVERLAP_ANALYSIS -> computeOverlaps(state);
                case BACKGROUND_MODEL -> computeBackground(state);
                case COADD -> coadd(state);
            };
        } catch (IOException e) {
            return StageResult.failed(stage, List.of(), e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private StageResult setupWorkdir(TileState state) throws IOException {
        state.work.create();
        state.work.installHeaders(state.headers.normal(), state.headers.expanded());
        return StageResult.ok(Stage.WORKDIR_SETUP);
    }

    private StageResult selectImages(TileState state) throws IOException {
        WorkingDirectory work = state.work;
        List<ToolResult> failures = new ArrayList<>();
        exec(montage.coverageCheck(settings.surveyImageTable(state.band), work.imageTable(), work.header()), failures);
        if (!Files.exists(work.imageTable())) {
            state.images = List.of();
            return StageResult.failed(Stage.IMAGE_SELECTION, failures, "no image table produced");
        }
        state.images = ImageTable.readImages(work.imageTable());
        LOG.info("Selected {} images", state.images.size());
        return StageResult.of(Stage.IMAGE_SELECTION, failures);
    }

    private StageResult copyImages(TileState state) throws IOException {
        WorkingDirectory work = state.work;
        List<String> images = state.images();
        List<ToolResult> failures = new ArrayList<>();
        Path confMap = settings.masterConfidenceMap(state.band);
        List<String> uncopied = new ArrayList<>();
        int i = 0;
        for (String image : images) {
            i++;
            String file = ImageTable.fileName(image);
            Path source = settings.imageDir().resolve(image);
            LOG.info("Copying files: image {} out of {}", i, images.size());
            if (settings.weightSource() == WeightSource.RESAMPLED) {
                exec(resample.resampleIntoWorkdir(source, confMap,
                        work.orig().resolve(file), work.conf().resolve(file)), failures);
            } else {
                Path compressed = work.orig().resolve(file + ".fz");
                try {
                    Files.copy(source, compressed, StandardCopyOption.REPLACE_EXISTING);
                } catch (IOException e) {
                    LOG.error("Could not copy {}: {}", source, e.toString());
                    uncopied.add(file);
                    continue;
                }
                exec(compression.decompress(compressed), failures);
            }
        }
        if (!uncopied.isEmpty()) {
            return StageResult.failed(Stage.IMAGE_COPY, failures, "could not copy: " + String.join(", ", uncopied));
        }
        return StageResult.of(Stage.IMAGE_COPY, failures);
    }

    private StageResult computeProjections(TileState state) throws IOException {
        WorkingDirectory work = state.work;
        List<String> images = state.images();
        if (images.isEmpty()) {
            return StageResult.failed(Stage.PROJECTION, List.of(), "no images selected for " + work.name());
        }
        boolean resampled = settings.weightSource() == WeightSource.RESAMPLED;
        List<Integer> hdus = resampled ? List.of(0) : List.of(1, 2, 3, 4);
        List<ToolResult> failures = new ArrayList<>();
        List<String> unreadable = new ArrayList<>();
        int i = 0;
        for (String image : images) {
            i++;
            LOG.info("Reprojecting image {} out of {}", i, images.size());
            String file = ImageTable.fileName(image);
            Path original = work.orig().resolve(file);
            Path weight = resampled ? work.conf().resolve(file) : settings.masterConfidenceMap(state.band);
            if (resampled) {
                try {
                    FitsHeaderEditor.normalizeEquinox(original);
                } catch (IOException e) {
                    LOG.error("Could not fix EQUINOX of {}: {}", original, e.getMessage());
                    unreadable.add(file);
                }
            }
            for (int hdu : hdus) {
                exec(montage.project(weight, settings.confThreshold(), hdu, original,
                        work.proj().resolve("hdu" + hdu + "_" + file), work.expandedHeader()), failures);
            }
        }
        exec(montage.imageTable(work.proj(), work.projectedTable()), failures);
        exec(montage.addWithDebug(work.proj(), work.projectedTable(), work.expandedHeader(), work.uncorrectedMosaic()), failures);
        exec(montage.quicklook(work.uncorrectedMosaic()), failures);
        if (!unreadable.isEmpty()) {
            return StageResult.failed(Stage.PROJECTION, failures, "unreadable headers: " + String.join(", ", unreadable));
        }
        return StageResult.of(Stage.PROJECTION, failures);
    }

    private StageResult computeOverlaps(TileState state) {
        WorkingDirectory work = state.work;
        List<ToolResult> failures = new ArrayList<>();
        exec(montage.overlaps(work.projectedTable(), work.diffTable()), failures);
        exec(montage.diffExec(work.proj(), work.diffTable(), work.expandedHeader(), work.diff()), failures);
        exec(montage.fitExec(work.diffTable(), work.fitTable(), work.diff()), failures);
        return StageResult.of(Stage.OVERLAP_ANALYSIS, failures);
    }

    private StageResult computeBackground(TileState state) {
        WorkingDirectory work = state.work;
        List<ToolResult> failures = new ArrayList<>();
        exec(montage.backgroundModel(settings.bgModelIterations(),
                work.projectedTable(), work.fitTable(), work.correctionTable()), failures);
        exec(montage.backgroundExec(work.proj(), work.projectedTable(), work.correctionTable(), work.corr()), failures);
        exec(montage.imageTable(work.corr(), work.correctedImageTable()), failures);
        return StageResult.of(Stage.BACKGROUND_MODEL, failures);
    }

    private StageResult coadd(TileState state) {
        WorkingDirectory work = state.work;
        List<ToolResult> failures = new ArrayList<>();
        exec(montage.add(work.corr(), work.correctedImageTable(), work.header(), work.mosaic()), failures);
        Path output = settings.outputDir().resolve(work.mosaic().getFileName());
        try {
            Files.copy(work.mosaic(), output, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            return StageResult.failed(Stage.COADD, failures, "could not copy " + work.mosaic() + " to " + output);
        }
        exec(montage.quicklook(output), failures);
        return StageResult.of(Stage.COADD, failures);
    }

    private void exec(ToolCommand command, List<ToolResult> failures) {
        ToolResult result = runner.run(command);
        if (!result.success()) {
            failures.add(result);
        }
    }

    /**
     * Per-run state handed between stages. The selection is loaded from the
     * image table on first use when image selection did not run in this call.
     */
    private static final class TileState {
        private final int tileIndex;
        private final Band band;
        private final HeaderFiles headers;
        private final WorkingDirectory work;
        private List<String> images;

        private TileState(int tileIndex, Band band, HeaderFiles headers, WorkingDirectory work) {
            this.tileIndex = tileIndex;
            this.band = band;
            this.headers = headers;
            this.work = work;
        }

        private List<String> images() throws IOException {
            if (images == null) {
                images = Files.exists(work.imageTable()) ? ImageTable.readImages(work.imageTable()) : List.of();
                LOG.debug("Tile {}: loaded {} images from {}", tileIndex, images.size(), work.imageTable());
            }
            return images;
        }
    }
}
