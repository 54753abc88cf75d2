package io.skymosaic.toolkit;

import io.skymosaic.tool.ToolCommand;

import java.nio.file.Path;

public final class CompressionCommands {
    private final ToolPaths paths;

    public CompressionCommands(ToolPaths paths) {
        this.paths = paths;
    }

    /**
     * {@code -D} deletes the uncompressed input, {@code -Y} suppresses the
     * confirmation prompt.
     */
    public ToolCommand compress(Path file) {
        return ToolCommand.of(paths.fpack("fpack"), "-D", "-Y", file);
    }

    public ToolCommand decompress(Path compressed) {
        return ToolCommand.of(paths.fpack("funpack"), "-D", compressed);
    }
}
