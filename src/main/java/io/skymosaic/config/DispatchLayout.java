package io.skymosaic.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Directory layout shared by a dispatcher and its workers on a common
 * filesystem.
 */
public final class DispatchLayout {
    public static final String DEFAULT_ROOT = "dispatch";

    private final Path rootDir;

    public DispatchLayout(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static DispatchLayout fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new DispatchLayout(resolved.toAbsolutePath().normalize());
    }

    /**
     * Maps a worker id onto a safe mailbox directory name.
     */
    public static String sanitizeWorkerId(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("worker id cannot be empty");
        }
        String normalized = raw.trim().toLowerCase();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        if (value.startsWith(".")) {
            value = "w" + value;
        }
        return value;
    }

    public void createDirectories() {
        try {
            Files.createDirectories(readyDir());
            Files.createDirectories(repliesRoot());
            Files.createDirectories(journalDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to create dispatch directories under " + rootDir, e);
        }
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path readyDir() {
        return rootDir.resolve("ready");
    }

    public Path repliesRoot() {
        return rootDir.resolve("replies");
    }

    public Path replyDir(String workerId) {
        return repliesRoot().resolve(sanitizeWorkerId(workerId));
    }

    public Path journalDir() {
        return rootDir.resolve("journal");
    }

    public Path journalFile() {
        return journalDir().resolve("dispatch.log");
    }
}
