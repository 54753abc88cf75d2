package io.skymosaic.toolkit;

import io.skymosaic.tool.ToolCommand;

import java.nio.file.Path;

/**
 * CASU {@code mosaic}: resamples one exposure and writes the image together with
 * its per-pixel weight map.
 */
public final class ResampleCommands {
    private final ToolPaths paths;

    public ResampleCommands(ToolPaths paths) {
        this.paths = paths;
    }

    /**
     * Worker form, used for the per-exposure jobs.
     */
    public ToolCommand resampleExposure(Path image, Path confMap, Path outImage, Path outConf) {
        return ToolCommand.of(paths.casutools("mosaic"), image, confMap, outImage, outConf, "--skyflag=0", "--verbose");
    }

    /**
     * Tile pipeline form, used when materializing images in a working directory.
     */
    public ToolCommand resampleIntoWorkdir(Path image, Path confMap, Path outImage, Path outWeight) {
        return ToolCommand.of(paths.casutools("mosaic"), image, confMap, outImage, outWeight, "--verbose", "--skyflag=0");
    }
}
