package io.skymosaic.cli;

import io.skymosaic.catalog.CatalogBuilder;
import io.skymosaic.catalog.CatalogReader;
import io.skymosaic.catalog.ConfidenceMapCache;
import io.skymosaic.catalog.CsvSurveyMetadata;
import io.skymosaic.config.DispatchLayout;
import io.skymosaic.config.MosaicSettings;
import io.skymosaic.dispatch.Backlog;
import io.skymosaic.dispatch.DispatchOutcome;
import io.skymosaic.dispatch.Dispatcher;
import io.skymosaic.dispatch.FileDispatchChannel;
import io.skymosaic.dispatch.InMemoryDispatchChannel;
import io.skymosaic.dispatch.WorkerAgent;
import io.skymosaic.dispatch.WorkerChannel;
import io.skymosaic.dispatch.WorkerOutcome;
import io.skymosaic.geometry.Tile;
import io.skymosaic.geometry.TileGeometry;
import io.skymosaic.model.Band;
import io.skymosaic.observability.RunJournal;
import io.skymosaic.pipeline.PipelineRun;
import io.skymosaic.pipeline.Stage;
import io.skymosaic.pipeline.StageResult;
import io.skymosaic.pipeline.StageSequencer;
import io.skymosaic.tool.ProcessToolRunner;
import io.skymosaic.toolkit.CompressionCommands;
import io.skymosaic.toolkit.ResampleCommands;
import io.skymosaic.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

@Command(
        name = "skymosaic",
        mixinStandardHelpOptions = true,
        description = "Tiled survey mosaic orchestration CLI",
        subcommands = {
                SkyMosaicCommand.HeaderCommand.class,
                SkyMosaicCommand.TilesCommand.class,
                SkyMosaicCommand.CatalogCommand.class,
                SkyMosaicCommand.MasterCommand.class,
                SkyMosaicCommand.WorkerCommand.class,
                SkyMosaicCommand.LocalCommand.class,
                SkyMosaicCommand.TileCommand.class
        }
)
public final class SkyMosaicCommand implements Runnable {
    @Option(names = {"--config"}, description = "Settings JSON file", defaultValue = MosaicSettings.DEFAULT_FILE_NAME)
    String config;

    @Override
    public void run() {
        System.out.println("Use subcommands: header | tiles | catalog | master | worker | local | tile");
    }

    MosaicSettings settings() {
        return MosaicSettings.load(Path.of(config));
    }

    static List<String> workerIds(int count) {
        List<String> ids = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            ids.add("w" + i);
        }
        return ids;
    }

    @Command(name = "header", description = "Print the projection header of one tile")
    static final class HeaderCommand implements Callable<Integer> {
        @ParentCommand
        SkyMosaicCommand parent;

        @Option(names = {"--tile"}, required = true, description = "Tile index")
        int tile;

        @Option(names = {"--band"}, defaultValue = "ha", description = "Band: ha|r|i")
        String band;

        @Option(names = {"--expanded"}, defaultValue = "false", description = "Use the expanded overlap")
        boolean expanded;

        @Option(names = {"--write"}, description = "Write both header variants into this directory instead")
        String writeDir;

        @Override
        public Integer call() {
            MosaicSettings settings = parent.settings();
            TileGeometry geometry = new TileGeometry(settings.survey());
            if (writeDir != null) {
                TileGeometry.HeaderFiles files = geometry.writeHeaders(tile, Band.fromString(band),
                        settings.overlap(), settings.expandedOverlap(), Path.of(writeDir));
                System.out.println(Jsons.toJson(files));
                return 0;
            }
            double overlap = expanded ? settings.expandedOverlap() : settings.overlap();
            System.out.print(geometry.computeHeader(tile, overlap).toText());
            return 0;
        }
    }

    @Command(name = "tiles", description = "List the tile grid")
    static final class TilesCommand implements Callable<Integer> {
        @ParentCommand
        SkyMosaicCommand parent;

        @Override
        public Integer call() {
            TileGeometry geometry = new TileGeometry(parent.settings().survey());
            List<Tile> tiles = new ArrayList<>();
            for (int i = 0; i < geometry.config().tileCount(); i++) {
                tiles.add(geometry.tile(i));
            }
            System.out.println(Jsons.toJson(tiles));
            return 0;
        }
    }

    @Command(name = "catalog", description = "Build the image catalog from a raw data directory")
    static final class CatalogCommand implements Callable<Integer> {
        @ParentCommand
        SkyMosaicCommand parent;

        @Option(names = {"--data"}, required = true, description = "Raw data directory")
        String dataDir;

        @Option(names = {"--metadata"}, required = true, description = "Survey metadata CSV (id,run_r,run_i,run_ha)")
        String metadata;

        @Option(names = {"--out"}, required = true, description = "Output catalog CSV")
        String out;

        @Override
        public Integer call() {
            MosaicSettings settings = parent.settings();
            Path data = Path.of(dataDir).toAbsolutePath().normalize();
            ConfidenceMapCache confmaps = new ConfidenceMapCache(data,
                    settings.confmapCandidates(), settings.directorySubstitutions());
            CatalogBuilder builder = new CatalogBuilder(data, CsvSurveyMetadata.load(Path.of(metadata)),
                    confmaps, settings.ignoredDirectories());
            int rows = builder.write(Path.of(out));
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("rows", rows);
            summary.put("confidenceMaps", confmaps.size());
            summary.put("output", Path.of(out).toAbsolutePath().toString());
            System.out.println(Jsons.toJson(summary));
            return 0;
        }
    }

    @Command(name = "master", description = "Hand out catalog jobs to workers over file mailboxes")
    static final class MasterCommand implements Callable<Integer> {
        @ParentCommand
        SkyMosaicCommand parent;

        @Option(names = {"--catalog"}, required = true, description = "Catalog CSV")
        String catalog;

        @Option(names = {"--root"}, defaultValue = DispatchLayout.DEFAULT_ROOT, description = "Shared dispatch directory")
        String root;

        @Option(names = {"--workers"}, defaultValue = "0", description = "Expected workers, named w1..wN")
        int workers;

        @Override
        public Integer call() throws Exception {
            MosaicSettings settings = parent.settings();
            DispatchLayout layout = DispatchLayout.fromRoot(root);
            FileDispatchChannel channel = new FileDispatchChannel(layout, settings.pollIntervalMs());
            channel.purgeReplies();
            RunJournal journal = new RunJournal(layout.journalFile());
            Backlog backlog = Backlog.fromRows(CatalogReader.read(Path.of(catalog)), journal);
            Dispatcher dispatcher = new Dispatcher(backlog, workerIds(workers), channel, journal);
            DispatchOutcome outcome = dispatcher.runToCompletion();
            System.out.println(Jsons.toJson(outcome));
            return 0;
        }
    }

    @Command(name = "worker", description = "Request and process jobs until shut down")
    static final class WorkerCommand implements Callable<Integer> {
        @ParentCommand
        SkyMosaicCommand parent;

        @Option(names = {"--root"}, defaultValue = DispatchLayout.DEFAULT_ROOT, description = "Shared dispatch directory")
        String root;

        @Option(names = {"--worker-id"}, required = true, description = "Worker identity")
        String workerId;

        @Override
        public Integer call() throws Exception {
            MosaicSettings settings = parent.settings();
            DispatchLayout layout = DispatchLayout.fromRoot(root);
            FileDispatchChannel channel = new FileDispatchChannel(layout, settings.pollIntervalMs());
            RunJournal journal = new RunJournal(layout.journalFile());
            WorkerOutcome outcome = newAgent(settings, DispatchLayout.sanitizeWorkerId(workerId), channel, journal).run();
            System.out.println(Jsons.toJson(outcome));
            return 0;
        }
    }

    @Command(name = "local", description = "Run master and workers as threads of this process")
    static final class LocalCommand implements Callable<Integer> {
        @ParentCommand
        SkyMosaicCommand parent;

        @Option(names = {"--catalog"}, required = true, description = "Catalog CSV")
        String catalog;

        @Option(names = {"--workers"}, defaultValue = "2", description = "Number of worker threads")
        int workers;

        @Option(names = {"--root"}, defaultValue = DispatchLayout.DEFAULT_ROOT, description = "Directory for the run journal")
        String root;

        @Override
        public Integer call() throws Exception {
            if (workers < 1) {
                throw new IllegalArgumentException("--workers must be >= 1");
            }
            MosaicSettings settings = parent.settings();
            RunJournal journal = new RunJournal(DispatchLayout.fromRoot(root).journalFile());
            InMemoryDispatchChannel channel = new InMemoryDispatchChannel();
            List<String> ids = workerIds(workers);
            Backlog backlog = Backlog.fromRows(CatalogReader.read(Path.of(catalog)), journal);
            Dispatcher dispatcher = new Dispatcher(backlog, ids, channel, journal);

            ExecutorService pool = Executors.newFixedThreadPool(workers);
            try {
                List<Future<WorkerOutcome>> futures = new ArrayList<>();
                for (String id : ids) {
                    WorkerAgent agent = newAgent(settings, id, channel, journal);
                    futures.add(pool.submit(agent::run));
                }
                DispatchOutcome outcome = dispatcher.runToCompletion();
                List<WorkerOutcome> outcomes = new ArrayList<>();
                for (Future<WorkerOutcome> future : futures) {
                    try {
                        outcomes.add(future.get());
                    } catch (ExecutionException e) {
                        throw new RuntimeException("Worker thread failed", e.getCause());
                    }
                }
                Map<String, Object> summary = new LinkedHashMap<>();
                summary.put("dispatch", outcome);
                summary.put("workers", outcomes);
                System.out.println(Jsons.toJson(summary));
            } finally {
                pool.shutdownNow();
            }
            return 0;
        }
    }

    @Command(name = "tile", description = "Build the mosaic of one tile")
    static final class TileCommand implements Callable<Integer> {
        @ParentCommand
        SkyMosaicCommand parent;

        @Option(names = {"--tile"}, required = true, description = "Tile index")
        int tile;

        @Option(names = {"--band"}, required = true, description = "Band: ha|r|i")
        String band;

        @Option(names = {"--from"}, defaultValue = "workdir",
                description = "First stage: workdir|select|copy|project|overlaps|background|coadd")
        String from;

        @Option(names = {"--clean"}, defaultValue = "false", description = "Empty diff/ and corr/ before running")
        boolean clean;

        @Override
        public Integer call() {
            MosaicSettings settings = parent.settings();
            StageSequencer sequencer = new StageSequencer(settings, new ProcessToolRunner(settings.failureRule()));
            PipelineRun run = sequencer.run(tile, Band.fromString(band), Stage.fromString(from), clean);
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("tile", run.tileName());
            summary.put("policy", run.policy());
            Map<String, String> stages = new LinkedHashMap<>();
            for (StageResult result : run.results()) {
                stages.put(result.stage().label(), result.status().name());
            }
            summary.put("stages", stages);
            summary.put("haltedAt", run.haltedAt().map(Stage::label).orElse(null));
            System.out.println(Jsons.toJson(summary));
            return run.succeeded() ? 0 : 1;
        }
    }

    static WorkerAgent newAgent(MosaicSettings settings, String workerId, WorkerChannel channel, RunJournal journal) {
        return new WorkerAgent(
                workerId,
                channel,
                new ProcessToolRunner(settings.failureRule()),
                new ResampleCommands(settings.tools()),
                new CompressionCommands(settings.tools()),
                settings.workerInputDir(),
                settings.workerOutputDir(),
                journal
        );
    }
}
