package io.skymosaic.tool;

/**
 * How a finished boundary process is classified.
 *
 * <p>{@link #STDERR_ONLY} treats any standard-error text as failure and ignores
 * the exit code; tools that print progress on standard error are therefore
 * always reported as failed.
 */
public enum FailureRule {
    STDERR_ONLY,
    STDERR_OR_EXIT_CODE;

    public boolean failed(int exitCode, String stderr) {
        boolean stderrPresent = stderr != null && !stderr.isBlank();
        return switch (this) {
            case STDERR_ONLY -> stderrPresent;
            case STDERR_OR_EXIT_CODE -> stderrPresent || exitCode != 0;
        };
    }

    public static FailureRule fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return STDERR_ONLY;
        }
        String normalized = raw.trim().replace('-', '_');
        for (FailureRule value : values()) {
            if (value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown failure rule: " + raw);
    }
}
