package io.skymosaic.model;

public enum MessageKind {
    READY,
    JOB,
    SHUTDOWN;

    public static MessageKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("message kind cannot be empty");
        }
        for (MessageKind value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown message kind: " + raw);
    }
}
