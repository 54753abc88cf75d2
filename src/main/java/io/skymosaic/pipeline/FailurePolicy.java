package io.skymosaic.pipeline;

/**
 * What the sequencer does after a stage reports failure. {@link #CONTINUE}
 * runs later stages against whatever the failed stage left behind.
 */
public enum FailurePolicy {
    CONTINUE,
    HALT;

    public static FailurePolicy fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return CONTINUE;
        }
        for (FailurePolicy value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown failure policy: " + raw);
    }
}
