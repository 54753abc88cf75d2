package io.skymosaic.dispatch;

import java.util.List;

public record WorkerOutcome(
        String workerId,
        int jobsReceived,
        int jobsSucceeded,
        List<String> failedJobs
) {
    public WorkerOutcome {
        failedJobs = List.copyOf(failedJobs);
    }

    public int jobsFailed() {
        return failedJobs.size();
    }
}
