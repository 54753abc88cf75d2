package io.skymosaic.model;

/**
 * One raw exposure to be resampled and compressed by a worker.
 *
 * <p>Image and confidence-map paths are relative to the worker's input
 * directory; {@code destination} is the output key ({@code <field>_<band>})
 * under the worker's output directory. No two jobs in a backlog share a
 * destination.
 */
public record Job(
        String runId,
        String fieldId,
        String band,
        String imagePath,
        String confMapPath,
        String destination
) {
    public Job {
        if (fieldId == null || fieldId.isBlank()) {
            throw new IllegalArgumentException("job field id cannot be empty (run " + runId + ")");
        }
        if (band == null || band.isBlank()) {
            throw new IllegalArgumentException("job band cannot be empty (run " + runId + ")");
        }
    }

    public static Job of(String runId, String fieldId, String band, String imagePath, String confMapPath) {
        return new Job(runId, fieldId, band, imagePath, confMapPath, destinationKey(fieldId, band));
    }

    public static String destinationKey(String fieldId, String band) {
        return fieldId + "_" + band;
    }

    public String outputImageName() {
        return destination + "_mosaic.fit";
    }

    public String outputConfName() {
        return destination + "_conf.fit";
    }

    public String label() {
        return fieldId + "_" + band;
    }
}
