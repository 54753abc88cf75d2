package io.skymosaic.tool;

public record ToolResult(
        ToolCommand command,
        boolean success,
        int exitCode,
        String stdout,
        String stderr
) {
    public static final int SPAWN_FAILED = -1;

    public static ToolResult spawnFailed(ToolCommand command, String error) {
        return new ToolResult(command, false, SPAWN_FAILED, "", error == null ? "spawn failed" : error);
    }

    public String describe() {
        return "STDERR={" + stderr + "} STDOUT={" + stdout + "} CMD={" + command.render() + "}";
    }
}
