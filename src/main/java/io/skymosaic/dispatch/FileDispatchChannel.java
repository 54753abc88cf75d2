package io.skymosaic.dispatch;

import io.skymosaic.config.DispatchLayout;
import io.skymosaic.model.DispatchMessage;
import io.skymosaic.model.MessageKind;
import io.skymosaic.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mailbox directories on a shared filesystem, so that the dispatcher and its
 * workers can run as separate processes on separate hosts.
 *
 * <p>Workers drop READY files into one inbox; names start with the wall-clock
 * millisecond so directory order is arrival order. Replies go to one directory
 * per worker, numbered by the dispatcher, so a pending JOB is never replaced by
 * a later SHUTDOWN. Every file is written under a temporary name and renamed
 * into place.
 */
public final class FileDispatchChannel implements MasterChannel, WorkerChannel {
    private static final String READY_SUFFIX = ".ready.json";
    private static final String REPLY_SUFFIX = ".reply.json";

    private final DispatchLayout layout;
    private final long pollIntervalMs;
    private final AtomicLong replySeq = new AtomicLong(0L);
    private final AtomicLong readySeq = new AtomicLong(0L);

    public FileDispatchChannel(DispatchLayout layout, long pollIntervalMs) {
        this.layout = layout;
        this.pollIntervalMs = Math.max(10L, pollIntervalMs);
        layout.createDirectories();
    }

    /**
     * Removes replies left over from an earlier run. Called by the dispatcher
     * before it starts answering.
     */
    public void purgeReplies() {
        try (DirectoryStream<Path> workers = Files.newDirectoryStream(layout.repliesRoot())) {
            for (Path dir : workers) {
                for (Path file : listFiles(dir, REPLY_SUFFIX)) {
                    Files.deleteIfExists(file);
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to purge replies under " + layout.repliesRoot(), e);
        }
    }

    @Override
    public DispatchMessage awaitReady() throws InterruptedException {
        while (true) {
            for (Path candidate : listFiles(layout.readyDir(), READY_SUFFIX)) {
                DispatchMessage message = read(candidate);
                if (message == null) {
                    continue;
                }
                delete(candidate);
                if (message.kind() != MessageKind.READY || message.workerId() == null) {
                    continue;
                }
                return message;
            }
            Thread.sleep(pollIntervalMs);
        }
    }

    @Override
    public void reply(String workerId, DispatchMessage message) {
        Path dir = layout.replyDir(workerId);
        String name = String.format("%012d", replySeq.incrementAndGet()) + REPLY_SUFFIX;
        writeAtomically(dir, name, message);
    }

    @Override
    public void discardPending() {
        for (Path file : listFiles(layout.readyDir(), READY_SUFFIX)) {
            delete(file);
        }
    }

    @Override
    public DispatchMessage requestWork(String workerId) throws InterruptedException {
        String safeId = DispatchLayout.sanitizeWorkerId(workerId);
        String name = System.currentTimeMillis() + "_"
                + String.format("%06d", readySeq.incrementAndGet()) + "_"
                + ProcessHandle.current().pid() + READY_SUFFIX;
        writeAtomically(layout.readyDir(), name, DispatchMessage.ready(safeId));

        Path inbox = layout.replyDir(safeId);
        while (true) {
            List<Path> replies = listFiles(inbox, REPLY_SUFFIX);
            if (!replies.isEmpty()) {
                Path first = replies.get(0);
                DispatchMessage response = read(first);
                if (response != null) {
                    delete(first);
                    if (response.isShutdown()) {
                        withdrawReady(safeId);
                    }
                    return response;
                }
            }
            Thread.sleep(pollIntervalMs);
        }
    }

    /**
     * A SHUTDOWN posted before this worker's last READY was consumed leaves that
     * READY behind; remove it so a later run does not answer it.
     */
    private void withdrawReady(String workerId) {
        for (Path file : listFiles(layout.readyDir(), READY_SUFFIX)) {
            DispatchMessage pending = read(file);
            if (pending != null && workerId.equals(pending.workerId())) {
                delete(file);
            }
        }
    }

    private void writeAtomically(Path dir, String name, DispatchMessage message) {
        try {
            Files.createDirectories(dir);
            Path tmp = dir.resolve("." + name + ".tmp");
            Files.writeString(tmp, Jsons.toCompactJson(message), StandardCharsets.UTF_8);
            Path target = dir.resolve(name);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException ignored) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to write dispatch message into " + dir, e);
        }
    }

    /**
     * Returns null when the file disappeared between listing and reading.
     */
    private DispatchMessage read(Path file) {
        try {
            return Jsons.fromJson(Files.readString(file, StandardCharsets.UTF_8), DispatchMessage.class);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read dispatch message: " + file, e);
        }
    }

    private void delete(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new RuntimeException("Failed to remove dispatch message: " + file, e);
        }
    }

    private List<Path> listFiles(Path dir, String suffix) {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + suffix)) {
            for (Path path : stream) {
                if (!path.getFileName().toString().startsWith(".")) {
                    files.add(path);
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to list " + dir, e);
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }
}
