package org.csdt.adinkra.ipc.lifecycle;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * LogDestination
 * =============================================================================
 * Where the channel's log lines go: an append-mode log file, or standard
 * output.
 *
 * <h2>File destination</h2>
 * {@link #open(Path)} attaches a Logback {@link FileAppender} to the
 * {@code org.csdt.adinkra} logger and stops that logger from also writing to
 * the console. Each line carries a UTC timestamp.
 *
 * <h2>Fallback</h2>
 * If the file cannot be opened, or SLF4J is not bound to Logback, the
 * destination falls back to standard output and logs a warning there.
 *
 * <h2>Closing</h2>
 * {@link #close()} detaches and stops the file appender exactly once. The
 * standard output destination is never closed.
 */
public final class LogDestination implements AutoCloseable
{
    /** Logger subtree redirected to the log file. */
    public static final String CHANNEL_LOGGER = "org.csdt.adinkra";

    static final String FILE_PATTERN = "[%d{yyyy-MM-dd HH:mm:ss.SSS,UTC}] %-5level %logger{36} - %msg%n";

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(LogDestination.class);

    private static final LogDestination STANDARD_OUTPUT = new LogDestination(null, null, true);

    private final Logger target;
    private final FileAppender<ILoggingEvent> appender;
    private final boolean originalAdditive;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private LogDestination(Logger target, FileAppender<ILoggingEvent> appender, boolean originalAdditive)
    {
        this.target = target;
        this.appender = appender;
        this.originalAdditive = originalAdditive;
    }

    public static LogDestination standardOutput()
    {
        return STANDARD_OUTPUT;
    }

    /**
     * Open a log destination.
     *
     * @param logFile file to append to; {@code null} selects standard output
     * @return the opened destination, standard output on failure
     */
    public static LogDestination open(Path logFile)
    {
        if (logFile == null) {
            return STANDARD_OUTPUT;
        }

        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            log.warn("file open error: logging backend is not Logback, cannot log to {}; using standard output",
                    logFile);
            return STANDARD_OUTPUT;
        }

        Path absolute = logFile.toAbsolutePath();
        if (Files.isDirectory(absolute)) {
            log.warn("file open error: {} is a directory; using standard output", absolute);
            return STANDARD_OUTPUT;
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(FILE_PATTERN);
        encoder.start();

        FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setContext(context);
        appender.setName("adinkra-ipc-file:" + absolute);
        appender.setFile(absolute.toString());
        appender.setAppend(true);
        appender.setEncoder(encoder);
        appender.start();

        if (!appender.isStarted()) {
            appender.stop();
            log.warn("file open error: cannot open {}; using standard output", absolute);
            return STANDARD_OUTPUT;
        }

        Logger target = context.getLogger(CHANNEL_LOGGER);
        boolean originalAdditive = target.isAdditive();
        target.addAppender(appender);
        target.setAdditive(false);
        return new LogDestination(target, appender, originalAdditive);
    }

    public boolean isStandardOutput()
    {
        return appender == null;
    }

    /**
     * The log file being written, if this is a file destination.
     */
    public Optional<Path> file()
    {
        return appender == null ? Optional.empty() : Optional.of(Path.of(appender.getFile()));
    }

    @Override
    public void close()
    {
        if (appender == null) {
            // Don't close standard output.
            return;
        }
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        target.detachAppender(appender);
        target.setAdditive(originalAdditive);
        appender.stop();
    }
}
