package io.skymosaic.tool;

public final class ToolExecutionException extends RuntimeException {
    private final ToolResult result;

    public ToolExecutionException(ToolResult result) {
        super("Command failed: " + result.command().render());
        this.result = result;
    }

    public ToolResult result() {
        return result;
    }
}
