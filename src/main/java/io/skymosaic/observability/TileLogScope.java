package io.skymosaic.observability;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.util.Map;

/**
 * Routes everything logged on the current thread while a tile is being
 * processed into {@code <dir>/log-<tile>.txt}.
 *
 * <p>Open it with try-with-resources: the appender is attached on construction
 * and detached and stopped in {@link #close()}. Events are matched on the MDC
 * key {@value #MDC_KEY}, so tiles processed on other threads never leak into
 * this file.
 */
public final class TileLogScope implements AutoCloseable {
    public static final String MDC_KEY = "tile";

    private static final Logger LOG = LoggerFactory.getLogger(TileLogScope.class);

    private final String tileName;
    private final Path logFile;
    private final String previousTile;
    private final FileAppender<ILoggingEvent> appender;
    private final ch.qos.logback.classic.Logger root;

    private TileLogScope(String tileName, Path logFile) {
        this.tileName = tileName;
        this.logFile = logFile;
        this.previousTile = MDC.get(MDC_KEY);
        MDC.put(MDC_KEY, tileName);

        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext) {
            LoggerContext context = (LoggerContext) factory;
            this.root = context.getLogger(Logger.ROOT_LOGGER_NAME);
            this.appender = fileAppender(context, tileName, logFile);
            root.addAppender(appender);
        } else {
            LOG.warn("Logging backend is not Logback; no per-tile log file for {}", tileName);
            this.root = null;
            this.appender = null;
        }
    }

    public static TileLogScope open(String tileName, Path logDir) {
        if (tileName == null || tileName.isBlank()) {
            throw new IllegalArgumentException("tile name cannot be empty");
        }
        return new TileLogScope(tileName, logDir.resolve("log-" + tileName + ".txt"));
    }

    public String tileName() {
        return tileName;
    }

    public Path logFile() {
        return logFile;
    }

    @Override
    public void close() {
        try {
            if (appender != null) {
                root.detachAppender(appender);
                appender.stop();
            }
        } finally {
            if (previousTile == null) {
                MDC.remove(MDC_KEY);
            } else {
                MDC.put(MDC_KEY, previousTile);
            }
        }
    }

    private static FileAppender<ILoggingEvent> fileAppender(LoggerContext context, String tileName, Path logFile) {
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss}/" + tileName + "/%level: %msg%n");
        encoder.start();

        FileAppender<ILoggingEvent> fileAppender = new FileAppender<>();
        fileAppender.setContext(context);
        fileAppender.setName("TILE-" + tileName);
        fileAppender.setFile(logFile.toString());
        fileAppender.setAppend(true);
        fileAppender.setEncoder(encoder);
        TileFilter filter = new TileFilter(tileName);
        filter.setContext(context);
        filter.start();
        fileAppender.addFilter(filter);
        fileAppender.start();
        return fileAppender;
    }

    private static final class TileFilter extends Filter<ILoggingEvent> {
        private final String tileName;

        private TileFilter(String tileName) {
            this.tileName = tileName;
        }

        @Override
        public FilterReply decide(ILoggingEvent event) {
            Map<String, String> mdc = event.getMDCPropertyMap();
            return mdc != null && tileName.equals(mdc.get(MDC_KEY)) ? FilterReply.NEUTRAL : FilterReply.DENY;
        }
    }
}
