package io.skymosaic.dispatch;

import io.skymosaic.model.DispatchMessage;

/**
 * Worker side of the exchange: send READY, block for JOB or SHUTDOWN.
 */
public interface WorkerChannel {
    DispatchMessage requestWork(String workerId) throws InterruptedException;
}
