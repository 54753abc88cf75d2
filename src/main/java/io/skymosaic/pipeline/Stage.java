package io.skymosaic.pipeline;

/**
 * Pipeline stages of one tile, in execution order.
 */
public enum Stage {
    WORKDIR_SETUP("workdir"),
    IMAGE_SELECTION("select"),
    IMAGE_COPY("copy"),
    PROJECTION("project"),
    OVERLAP_ANALYSIS("overlaps"),
    BACKGROUND_MODEL("background"),
    COADD("coadd");

    private final String label;

    Stage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Accepts either the enum name or the short label, case-insensitively.
     */
    public static Stage fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return WORKDIR_SETUP;
        }
        String value = raw.trim();
        for (Stage stage : values()) {
            if (stage.name().equalsIgnoreCase(value.replace('-', '_')) || stage.label.equalsIgnoreCase(value)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown stage: " + raw);
    }

    @Override
    public String toString() {
        return label;
    }
}
