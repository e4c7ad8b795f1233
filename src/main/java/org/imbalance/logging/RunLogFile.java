package org.imbalance.logging;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Sends every log line of the run to a timestamped file instead of the console.
 * <p>
 * The redirection is skipped when a debugger is attached to the JVM. Closing the
 * instance puts the console handlers back, so a run aborted by an exception
 * still restores the console when opened in a try-with-resources block.
 */
public final class RunLogFile implements AutoCloseable {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final List<Logger> loggers;
    private final Map<Logger, Handler[]> suspended = new LinkedHashMap<>();
    private final FileHandler fileHandler;
    private final Path file;
    private boolean closed = false;

    private RunLogFile(List<Logger> loggers, FileHandler fileHandler, Path file) {
        this.loggers = loggers;
        this.fileHandler = fileHandler;
        this.file = file;
    }

    public static RunLogFile open(Path logDir, String runName) throws IOException {
        return open(logDir, runName, isDebuggerAttached());
    }

    static RunLogFile open(Path logDir, String runName, boolean debuggerAttached) throws IOException {
        List<Logger> loggers = List.of(Printer.getInstance().getLogger(), Logger.getLogger(""));
        if (debuggerAttached) {
            Printer.printlnBlue("Debugger attached, logging to console");
            return new RunLogFile(loggers, null, null);
        }

        Files.createDirectories(logDir);
        Path file = logDir.resolve(runName + "_" + LocalDateTime.now().format(TIMESTAMP) + "_stdout.txt");
        FileHandler handler = new FileHandler(file.toString(), false);
        handler.setLevel(Level.ALL);
        handler.setFormatter(new PlainFormatter());

        RunLogFile logFile = new RunLogFile(loggers, handler, file);
        logFile.redirect();
        return logFile;
    }

    private void redirect() {
        for (Logger logger : loggers) {
            Handler[] handlers = logger.getHandlers();
            suspended.put(logger, handlers);
            for (Handler handler : handlers) {
                logger.removeHandler(handler);
            }
            logger.addHandler(fileHandler);
        }
    }

    public boolean isActive() {
        return fileHandler != null && !closed;
    }

    /**
     * @return the log file, or {@code null} when output stays on the console
     */
    public Path getFile() {
        return file;
    }

    @Override
    public synchronized void close() {
        if (closed || fileHandler == null) {
            closed = true;
            return;
        }
        closed = true;
        for (Map.Entry<Logger, Handler[]> entry : suspended.entrySet()) {
            Logger logger = entry.getKey();
            logger.removeHandler(fileHandler);
            for (Handler handler : entry.getValue()) {
                logger.addHandler(handler);
            }
        }
        fileHandler.close();
        Printer.println("Log written to " + file);
    }

    static boolean isDebuggerAttached() {
        return ManagementFactory.getRuntimeMXBean().getInputArguments().stream()
                .anyMatch(arg -> arg.startsWith("-agentlib:jdwp") || arg.startsWith("-Xrunjdwp"));
    }

    private static final class PlainFormatter extends Formatter {
        @Override
        public String format(LogRecord logRecord) {
            return String.format("[%s] %s%n", logRecord.getLevel(), Printer.stripColors(formatMessage(logRecord)));
        }
    }
}
