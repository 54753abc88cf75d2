package io.skymosaic.dispatch;

import java.util.List;

public record DispatchOutcome(
        int jobsAssigned,
        int shutdownsSent,
        List<String> workers
) {
    public DispatchOutcome {
        workers = List.copyOf(workers);
    }
}
