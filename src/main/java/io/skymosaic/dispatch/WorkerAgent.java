package io.skymosaic.dispatch;

import io.skymosaic.model.DispatchMessage;
import io.skymosaic.model.Job;
import io.skymosaic.observability.RunJournal;
import io.skymosaic.tool.ExternalToolRunner;
import io.skymosaic.tool.ToolExecutionException;
import io.skymosaic.toolkit.CompressionCommands;
import io.skymosaic.toolkit.ResampleCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Requests jobs until told to shut down. Each job resamples one exposure and
 * compresses both outputs; a failing command ends that job only.
 */
public final class WorkerAgent {
    public static final String MDC_KEY = "worker";

    private static final Logger LOG = LoggerFactory.getLogger(WorkerAgent.class);

    private final String workerId;
    private final WorkerChannel channel;
    private final ExternalToolRunner runner;
    private final ResampleCommands resample;
    private final CompressionCommands compression;
    private final Path inputDir;
    private final Path outputDir;
    private final RunJournal journal;

    public WorkerAgent(
            String workerId,
            WorkerChannel channel,
            ExternalToolRunner runner,
            ResampleCommands resample,
            CompressionCommands compression,
            Path inputDir,
            Path outputDir,
            RunJournal journal
    ) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("worker id cannot be empty");
        }
        this.workerId = workerId;
        this.channel = channel;
        this.runner = runner;
        this.resample = resample;
        this.compression = compression;
        this.inputDir = inputDir;
        this.outputDir = outputDir;
        this.journal = journal;
    }

    public String workerId() {
        return workerId;
    }

    public WorkerOutcome run() throws InterruptedException {
        String previous = MDC.get(MDC_KEY);
        MDC.put(MDC_KEY, workerId);
        int received = 0;
        int succeeded = 0;
        List<String> failed = new ArrayList<>();
        try {
            LOG.info("Worker {} started", workerId);
            while (true) {
                DispatchMessage message = channel.requestWork(workerId);
                if (message.isShutdown()) {
                    break;
                }
                if (message.job() == null) {
                    LOG.warn("Ignoring {} message without a job", message.kind());
                    continue;
                }
                received++;
                if (process(message.job())) {
                    succeeded++;
                } else {
                    failed.add(message.job().label());
                }
            }
            LOG.info("Worker {} shutting down: {} jobs, {} failed", workerId, received, failed.size());
            return new WorkerOutcome(workerId, received, succeeded, failed);
        } finally {
            if (previous == null) {
                MDC.remove(MDC_KEY);
            } else {
                MDC.put(MDC_KEY, previous);
            }
        }
    }

    /**
     * Runs the command sequence for one job. Returns false on the first
     * failure; later commands of that job are not attempted.
     */
    public boolean process(Job job) {
        Path image = inputDir.resolve(job.imagePath());
        Path confMap = inputDir.resolve(job.confMapPath());
        Path outImage = outputDir.resolve(job.outputImageName());
        Path outConf = outputDir.resolve(job.outputConfName());
        LOG.info("Processing {} ({})", job.label(), job.imagePath());
        try {
            Files.createDirectories(outputDir);
            runner.runChecked(resample.resampleExposure(image, confMap, outImage, outConf));
            for (Path output : List.of(outImage, outConf)) {
                Files.deleteIfExists(Path.of(output + ".fz"));
                runner.runChecked(compression.compress(output));
            }
        } catch (ToolExecutionException e) {
            LOG.error("Aborted {}: {} failed", job.label(), e.result().command().executable());
            record("job.failed", job, Map.of("command", e.result().command().render(), "stderr", e.result().stderr()));
            return false;
        } catch (IOException e) {
            LOG.error("Aborted {}: {}", job.label(), e.getMessage());
            record("job.failed", job, Map.of("error", String.valueOf(e.getMessage())));
            return false;
        }
        LOG.info("Finished {}", job.label());
        record("job.done", job, Map.of("image", outImage.getFileName().toString()));
        return true;
    }

    private void record(String action, Job job, Map<String, Object> details) {
        if (journal != null) {
            journal.log(RunJournal.Event.of(action, workerId, job.destination(),
                    action.equals("job.done") ? "ok" : "failed", details));
        }
    }
}
