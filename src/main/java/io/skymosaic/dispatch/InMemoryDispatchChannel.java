package io.skymosaic.dispatch;

import io.skymosaic.model.DispatchMessage;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Queue-backed channel for a dispatcher and workers living in one JVM.
 */
public final class InMemoryDispatchChannel implements MasterChannel, WorkerChannel {
    private final BlockingQueue<DispatchMessage> ready = new LinkedBlockingQueue<>();
    private final ConcurrentMap<String, BlockingQueue<DispatchMessage>> mailboxes = new ConcurrentHashMap<>();

    @Override
    public DispatchMessage awaitReady() throws InterruptedException {
        return ready.take();
    }

    @Override
    public void reply(String workerId, DispatchMessage message) {
        mailbox(workerId).add(message);
    }

    @Override
    public void discardPending() {
        ready.clear();
    }

    @Override
    public DispatchMessage requestWork(String workerId) throws InterruptedException {
        BlockingQueue<DispatchMessage> inbox = mailbox(workerId);
        ready.add(DispatchMessage.ready(workerId));
        DispatchMessage response = inbox.take();
        if (response.isShutdown()) {
            ready.removeIf(msg -> workerId.equals(msg.workerId()));
        }
        return response;
    }

    private BlockingQueue<DispatchMessage> mailbox(String workerId) {
        return mailboxes.computeIfAbsent(workerId, id -> new LinkedBlockingQueue<>());
    }
}
