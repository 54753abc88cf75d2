/**
 * Master/worker work distribution.
 *
 * <p>Workers send READY and block; the {@link io.skymosaic.dispatch.Dispatcher}
 * answers with a JOB or SHUTDOWN. The exchange runs over
 * {@link io.skymosaic.dispatch.FileDispatchChannel} between processes or
 * {@link io.skymosaic.dispatch.InMemoryDispatchChannel} between threads.
 */
package io.skymosaic.dispatch;
