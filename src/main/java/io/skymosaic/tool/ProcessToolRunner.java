package io.skymosaic.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runs boundary commands as child processes. Both streams are redirected to
 * temporary files so a chatty tool cannot block on a full pipe.
 */
public final class ProcessToolRunner implements ExternalToolRunner {
    private static final Logger LOG = LoggerFactory.getLogger(ProcessToolRunner.class);

    private final FailureRule failureRule;
    private final Path workingDir;

    public ProcessToolRunner(FailureRule failureRule) {
        this(failureRule, null);
    }

    public ProcessToolRunner(FailureRule failureRule, Path workingDir) {
        this.failureRule = failureRule == null ? FailureRule.STDERR_ONLY : failureRule;
        this.workingDir = workingDir;
    }

    public FailureRule failureRule() {
        return failureRule;
    }

    @Override
    public ToolResult run(ToolCommand command) {
        LOG.debug(command.render());
        Path stdoutFile = null;
        Path stderrFile = null;
        try {
            stdoutFile = Files.createTempFile("skymosaic-out-", ".txt");
            stderrFile = Files.createTempFile("skymosaic-err-", ".txt");
            ProcessBuilder pb = new ProcessBuilder(command.argv());
            if (workingDir != null) {
                pb.directory(workingDir.toFile());
            }
            pb.redirectOutput(stdoutFile.toFile());
            pb.redirectError(stderrFile.toFile());

            Process process;
            try {
                process = pb.start();
            } catch (IOException e) {
                ToolResult failed = ToolResult.spawnFailed(command, "spawn failed: " + e.getMessage());
                LOG.error(failed.describe());
                return failed;
            }
            process.getOutputStream().close();
            int exitCode = process.waitFor();
            String stdout;
            String stderr;
            try {
                stdout = capture(stdoutFile);
                stderr = capture(stderrFile);
            } catch (IOException e) {
                ToolResult failed = new ToolResult(command, false, exitCode, "",
                        "could not read command output: " + e.getMessage());
                LOG.error("{} EXIT={}", failed.describe(), exitCode);
                return failed;
            }
            ToolResult result = new ToolResult(command, !failureRule.failed(exitCode, stderr), exitCode, stdout, stderr);
            if (result.success()) {
                if (!stdout.isEmpty()) {
                    LOG.debug(stdout);
                }
            } else {
                LOG.error("{} EXIT={}", result.describe(), exitCode);
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ToolResult failed = ToolResult.spawnFailed(command, "interrupted while waiting for command");
            LOG.error(failed.describe());
            return failed;
        } catch (IOException e) {
            ToolResult failed = ToolResult.spawnFailed(command, "could not set up output capture: " + e.getMessage());
            LOG.error(failed.describe());
            return failed;
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    /**
     * Undecodable bytes become replacement characters; tools are not bound to
     * write UTF-8.
     */
    private static String capture(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8).strip();
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Could not remove capture file {}: {}", path, e.getMessage());
        }
    }
}
