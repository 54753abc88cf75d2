package io.skymosaic.toolkit;

import io.skymosaic.tool.ToolCommand;

import java.nio.file.Path;

/**
 * Argument lists for the Montage executables. Positional order follows each
 * tool's command-line contract and must not be rearranged.
 */
public final class MontageCommands {
    private final ToolPaths paths;

    public MontageCommands(ToolPaths paths) {
        this.paths = paths;
    }

    public ToolCommand coverageCheck(Path surveyTable, Path imageTable, Path header) {
        return ToolCommand.of(paths.montage("mCoverageCheck"), surveyTable, imageTable, "-header", header);
    }

    public ToolCommand project(Path weightMap, int confThreshold, int hdu, Path input, Path output, Path header) {
        return ToolCommand.of(paths.montage("mProject"),
                "-w", weightMap,
                "-t", confThreshold,
                "-h", hdu,
                input, output, header);
    }

    public ToolCommand imageTable(Path imageDir, Path table) {
        return ToolCommand.of(paths.montage("mImgtbl"), "-c", imageDir, table);
    }

    /**
     * Co-add with a debug level, used for the uncorrected preview mosaic.
     */
    public ToolCommand addWithDebug(Path imageDir, Path table, Path header, Path output) {
        return ToolCommand.of(paths.montage("mAdd"), "-d", 1, "-a", "mean", "-e", "-p", imageDir, table, header, output);
    }

    public ToolCommand add(Path imageDir, Path table, Path header, Path output) {
        return ToolCommand.of(paths.montage("mAdd"), "-a", "mean", "-e", "-p", imageDir, table, header, output);
    }

    public ToolCommand quicklook(Path fits) {
        return ToolCommand.of(paths.montage("mJPEG"), "-gray", fits, 20, 200, "log", "-out", fits + ".jpg");
    }

    public ToolCommand overlaps(Path projectedTable, Path diffTable) {
        return ToolCommand.of(paths.montage("mOverlaps"), projectedTable, diffTable);
    }

    public ToolCommand diffExec(Path projectedDir, Path diffTable, Path header, Path diffDir) {
        return ToolCommand.of(paths.montage("mDiffExec"), "-p", projectedDir, diffTable, header, diffDir);
    }

    public ToolCommand fitExec(Path diffTable, Path fitTable, Path diffDir) {
        return ToolCommand.of(paths.montage("mFitExec"), diffTable, fitTable, diffDir);
    }

    public ToolCommand backgroundModel(int iterations, Path projectedTable, Path fitTable, Path correctionTable) {
        return ToolCommand.of(paths.montage("mBgModel"), "-l", "-i", iterations, projectedTable, fitTable, correctionTable);
    }

    public ToolCommand backgroundExec(Path projectedDir, Path projectedTable, Path correctionTable, Path correctedDir) {
        return ToolCommand.of(paths.montage("mBgExec"), "-p", projectedDir, projectedTable, correctionTable, correctedDir);
    }
}
