package io.skymosaic.dispatch;

import io.skymosaic.model.DispatchMessage;
import io.skymosaic.model.Job;
import io.skymosaic.observability.RunJournal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Master side of the work distribution. Hands out backlog jobs to whichever
 * worker asks first, one job per request, and shuts every known worker down
 * once the backlog is empty.
 *
 * <p>Each job leaves the backlog exactly once. There is no liveness check: a
 * job handed to a worker that dies is never reported.
 */
public final class Dispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(Dispatcher.class);

    private final Deque<Job> backlog;
    private final MasterChannel channel;
    private final RunJournal journal;
    private final Set<String> workers = new LinkedHashSet<>();
    private final Set<String> shutDown = new HashSet<>();
    private int jobsAssigned;

    public Dispatcher(Backlog backlog, Collection<String> expectedWorkers, MasterChannel channel, RunJournal journal) {
        this.backlog = new ArrayDeque<>(backlog.jobs());
        this.channel = channel;
        this.journal = journal;
        if (expectedWorkers != null) {
            workers.addAll(expectedWorkers);
        }
    }

    /**
     * Answers one READY: the next job in catalog order, or SHUTDOWN when
     * nothing is left.
     */
    public synchronized DispatchMessage onWorkerReady(String workerId) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("READY without worker id");
        }
        workers.add(workerId);
        Job job = backlog.pollFirst();
        if (job == null) {
            markShutdown(workerId);
            return DispatchMessage.shutdown();
        }
        jobsAssigned++;
        LOG.info("Assigning {} to {} ({} left)", job.label(), workerId, backlog.size());
        record("job.assign", workerId, job.destination(), "ok",
                Map.of("run", job.runId(), "image", job.imagePath()));
        return DispatchMessage.job(job);
    }

    /**
     * Serves requests in arrival order until the backlog is empty, then posts
     * SHUTDOWN to every worker that has not had one, including workers whose
     * final READY has not arrived yet.
     */
    public DispatchOutcome runToCompletion() throws InterruptedException {
        LOG.info("Dispatching {} jobs to {} expected workers", remaining(), workers.size());
        while (remaining() > 0) {
            DispatchMessage request = channel.awaitReady();
            String workerId = request.workerId();
            channel.reply(workerId, onWorkerReady(workerId));
        }
        for (String workerId : pendingShutdown()) {
            markShutdown(workerId);
            channel.reply(workerId, DispatchMessage.shutdown());
        }
        channel.discardPending();
        DispatchOutcome outcome = outcome();
        LOG.info("Backlog exhausted: {} jobs assigned, {} workers shut down",
                outcome.jobsAssigned(), outcome.shutdownsSent());
        return outcome;
    }

    public synchronized int remaining() {
        return backlog.size();
    }

    public synchronized DispatchOutcome outcome() {
        return new DispatchOutcome(jobsAssigned, shutDown.size(), new ArrayList<>(workers));
    }

    private synchronized Collection<String> pendingShutdown() {
        Set<String> pending = new LinkedHashSet<>(workers);
        pending.removeAll(shutDown);
        return pending;
    }

    private synchronized void markShutdown(String workerId) {
        if (shutDown.add(workerId)) {
            LOG.info("Shutting down {}", workerId);
            record("worker.shutdown", "master", workerId, "ok", Map.of());
        }
    }

    private void record(String action, String actor, String resource, String result, Map<String, Object> details) {
        if (journal != null) {
            journal.log(RunJournal.Event.of(action, actor, resource, result, details));
        }
    }
}
