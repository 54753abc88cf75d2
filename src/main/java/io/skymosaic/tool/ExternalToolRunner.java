package io.skymosaic.tool;

/**
 * Executes boundary commands. Implementations capture standard output and
 * standard error separately and classify the outcome; they never throw for a
 * failed command.
 */
public interface ExternalToolRunner {
    ToolResult run(ToolCommand command);

    default ToolResult runChecked(ToolCommand command) {
        ToolResult result = run(command);
        if (!result.success()) {
            throw new ToolExecutionException(result);
        }
        return result;
    }
}
