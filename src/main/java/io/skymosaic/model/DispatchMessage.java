package io.skymosaic.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Wire message between dispatcher and workers.
 *
 * <p>{@code READY} carries the sender's worker id, {@code JOB} carries the job,
 * {@code SHUTDOWN} carries nothing.
 */
public record DispatchMessage(
        MessageKind kind,
        String workerId,
        Job job
) {
    public DispatchMessage {
        if (kind == null) {
            throw new IllegalArgumentException("message kind cannot be null");
        }
        if (kind == MessageKind.JOB && job == null) {
            throw new IllegalArgumentException("JOB message requires a job");
        }
    }

    public static DispatchMessage ready(String workerId) {
        return new DispatchMessage(MessageKind.READY, workerId, null);
    }

    public static DispatchMessage job(Job job) {
        return new DispatchMessage(MessageKind.JOB, null, job);
    }

    public static DispatchMessage shutdown() {
        return new DispatchMessage(MessageKind.SHUTDOWN, null, null);
    }

    @JsonIgnore
    public boolean isShutdown() {
        return kind == MessageKind.SHUTDOWN;
    }
}
