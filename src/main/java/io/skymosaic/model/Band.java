package io.skymosaic.model;

public enum Band {
    HA("ha"),
    R("r"),
    I("i");

    private final String label;

    Band(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Band fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Band cannot be empty");
        }
        String value = raw.trim();
        for (Band band : values()) {
            if (band.name().equalsIgnoreCase(value) || band.label.equalsIgnoreCase(value)) {
                return band;
            }
        }
        throw new IllegalArgumentException("Unknown band: " + raw);
    }

    @Override
    public String toString() {
        return label;
    }
}
