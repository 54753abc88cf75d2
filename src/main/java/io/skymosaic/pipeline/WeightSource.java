package io.skymosaic.pipeline;

/**
 * Where the per-pixel weights used during projection come from.
 */
public enum WeightSource {
    /** Weight maps written by the resampling tool next to each copied image; HDU 0 only. */
    RESAMPLED,
    /** The survey's master confidence map for the band; extension HDUs 1-4. */
    CONFIDENCE_MAP;

    public static WeightSource fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return RESAMPLED;
        }
        String normalized = raw.trim().replace('-', '_');
        for (WeightSource value : values()) {
            if (value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown weight source: " + raw);
    }
}
