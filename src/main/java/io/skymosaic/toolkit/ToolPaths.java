package io.skymosaic.toolkit;

import java.nio.file.Path;

/**
 * Installation directories of the external toolkits.
 */
public record ToolPaths(Path montageDir, Path casutoolsDir, Path fpackDir) {
    public ToolPaths {
        if (montageDir == null || casutoolsDir == null || fpackDir == null) {
            throw new IllegalArgumentException("tool directories cannot be null");
        }
    }

    String montage(String tool) {
        return montageDir.resolve(tool).toString();
    }

    String casutools(String tool) {
        return casutoolsDir.resolve(tool).toString();
    }

    String fpack(String tool) {
        return fpackDir.resolve(tool).toString();
    }
}
