package io.skymosaic.dispatch;

import io.skymosaic.model.DispatchMessage;

/**
 * Dispatcher side of the request/response exchange.
 */
public interface MasterChannel {
    /**
     * Blocks until some worker reports READY; requests are returned in
     * arrival order.
     */
    DispatchMessage awaitReady() throws InterruptedException;

    void reply(String workerId, DispatchMessage message);

    /**
     * Drops READY requests that will never be answered with a job.
     */
    void discardPending();
}
