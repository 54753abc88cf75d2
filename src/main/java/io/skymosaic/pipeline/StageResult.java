package io.skymosaic.pipeline;

import io.skymosaic.tool.ToolResult;

import java.util.List;

/**
 * Outcome of one stage. A failed stage carries the failed tool results, or a
 * message when it failed without running a tool.
 */
public record StageResult(
        Stage stage,
        Status status,
        List<ToolResult> failures,
        String message
) {
    public enum Status {
        OK,
        FAILED,
        SKIPPED
    }

    public StageResult {
        if (stage == null || status == null) {
            throw new IllegalArgumentException("stage and status are required");
        }
        failures = failures == null ? List.of() : List.copyOf(failures);
        message = message == null ? "" : message;
    }

    public static StageResult ok(Stage stage) {
        return new StageResult(stage, Status.OK, List.of(), "");
    }

    public static StageResult skipped(Stage stage, String reason) {
        return new StageResult(stage, Status.SKIPPED, List.of(), reason);
    }

    public static StageResult failed(Stage stage, List<ToolResult> failures, String message) {
        return new StageResult(stage, Status.FAILED, failures, message);
    }

    /**
     * OK when no command failed, FAILED otherwise.
     */
    public static StageResult of(Stage stage, List<ToolResult> failures) {
        if (failures.isEmpty()) {
            return ok(stage);
        }
        return failed(stage, failures, failures.size() + " command(s) failed");
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
