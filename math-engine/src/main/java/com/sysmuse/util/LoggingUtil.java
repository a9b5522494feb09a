package com.sysmuse.util;

import com.sysmuse.math.config.EngineConfig;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.logging.*;

/**
 * Centralized logging for the math engine and calculator session.
 * Wraps java.util.logging behind a small static interface.
 */
public class LoggingUtil {
    public enum ConsoleOutputMode {
        ALL_TO_OUT,
        ALL_TO_ERR,
        SPLIT_SEVERE_TO_ERR
    }

    private static final Logger logger = Logger.getLogger("com.sysmuse");
    private static boolean initialized = false;
    private static Level currentLevel = Level.INFO;
    private static boolean consoleLogging = false;
    private static boolean fileLogging = false;
    private static String logFileName = "math-engine.log";
    private static ConsoleOutputMode consoleOutputMode = ConsoleOutputMode.SPLIT_SEVERE_TO_ERR;

    /**
     * One line per record: time, level, message, then the stack trace if any.
     */
    private static class LineFormatter extends Formatter {
        @Override
        public String format(LogRecord record) {
            StringBuilder sb = new StringBuilder();
            sb.append(String.format("%1$tF %1$tT", record.getMillis()))
                    .append(' ').append(record.getLevel().getName())
                    .append(' ').append(formatMessage(record))
                    .append(System.lineSeparator());
            if (record.getThrown() != null) {
                StringWriter trace = new StringWriter();
                record.getThrown().printStackTrace(new PrintWriter(trace));
                sb.append(trace);
            }
            return sb.toString();
        }
    }

    /**
     * Writes records in [level, ceiling) to a console stream, flushing after each.
     */
    private static class ConsoleStreamHandler extends StreamHandler {
        private final Level ceiling;

        ConsoleStreamHandler(OutputStream out, Level level, Level ceiling) {
            super(out, new LineFormatter());
            this.ceiling = ceiling;
            setLevel(level);
        }

        @Override
        public boolean isLoggable(LogRecord record) {
            if (ceiling != null && record.getLevel().intValue() >= ceiling.intValue()) {
                return false;
            }
            return super.isLoggable(record);
        }

        @Override
        public synchronized void publish(LogRecord record) {
            super.publish(record);
            flush();
        }

        // System streams stay open after the handler is removed
        @Override
        public synchronized void close() {
            flush();
        }
    }

    /**
     * Configure where log messages go in console
     */
    public static void setConsoleOutputMode(ConsoleOutputMode mode) {
        consoleOutputMode = mode;
    }

    /**
     * Initialize logging from the engine configuration
     */
    public static synchronized void initialize(EngineConfig config) {
        initialize(config.getLoggingLevel(), config.isConsoleLoggingEnabled(),
                config.isFileLoggingEnabled(), config.getLogFileName());
    }

    public static synchronized void initialize(String levelStr, boolean consoleEnabled, boolean fileEnabled, String fileName) {
        if (initialized) {
            return;
        }

        setLoggingLevel(levelStr);
        clearHandlers();

        if (consoleEnabled) {
            setupConsoleHandlers();
        }

        if (fileEnabled && fileName != null && !fileName.isEmpty()) {
            try {
                FileHandler fileHandler = new FileHandler(fileName, true);
                fileHandler.setFormatter(new LineFormatter());
                fileHandler.setLevel(currentLevel);
                logger.addHandler(fileHandler);
                fileLogging = true;
                logFileName = fileName;
            } catch (IOException e) {
                fileLogging = false;
                logger.log(Level.SEVERE, "Failed to create log file: " + fileName, e);
            }
        }

        logger.setLevel(currentLevel);
        logger.setUseParentHandlers(false);
        initialized = true;

        logger.fine("Logging initialized: level=" + currentLevel +
                ", console=" + consoleLogging +
                ", file=" + (fileLogging ? logFileName : "disabled"));
    }

    /**
     * Drop all handlers so the next call to initialize takes effect. Used by tests.
     */
    public static synchronized void reset() {
        clearHandlers();
        initialized = false;
        consoleLogging = false;
        fileLogging = false;
        currentLevel = Level.INFO;
    }

    private static void setLoggingLevel(String levelStr) {
        String level = levelStr == null ? "INFO" : levelStr.toUpperCase();
        switch (level) {
            case "SEVERE":
            case "ERROR":
                currentLevel = Level.SEVERE;
                break;
            case "WARNING":
            case "WARN":
                currentLevel = Level.WARNING;
                break;
            case "DEBUG":
                currentLevel = Level.FINE;
                break;
            case "TRACE":
                currentLevel = Level.FINEST;
                break;
            case "OFF":
                currentLevel = Level.OFF;
                break;
            default:
                currentLevel = Level.INFO;
        }
    }

    private static void clearHandlers() {
        for (Handler handler : logger.getHandlers()) {
            logger.removeHandler(handler);
            handler.close();
        }
    }

    private static void setupConsoleHandlers() {
        switch (consoleOutputMode) {
            case ALL_TO_OUT:
                logger.addHandler(new ConsoleStreamHandler(System.out, currentLevel, null));
                break;
            case ALL_TO_ERR:
                logger.addHandler(new ConsoleStreamHandler(System.err, currentLevel, null));
                break;
            case SPLIT_SEVERE_TO_ERR:
                logger.addHandler(new ConsoleStreamHandler(System.out, currentLevel, Level.SEVERE));
                logger.addHandler(new ConsoleStreamHandler(System.err, Level.SEVERE, null));
                break;
        }
        consoleLogging = true;
    }

    public static void debug(String message) {
        ensureInitialized();
        logger.fine(message);
    }

    public static void debug(String message, Throwable t) {
        ensureInitialized();
        logger.log(Level.FINE, message, t);
    }

    public static void info(String message) {
        ensureInitialized();
        logger.info(message);
    }

    public static void warn(String message) {
        ensureInitialized();
        logger.warning(message);
    }

    public static void warn(String message, Throwable t) {
        ensureInitialized();
        logger.log(Level.WARNING, message, t);
    }

    public static void error(String message) {
        ensureInitialized();
        logger.severe(message);
    }

    public static void error(String message, Throwable t) {
        ensureInitialized();
        logger.log(Level.SEVERE, message, t);
    }

    public static boolean isDebugEnabled() {
        return currentLevel.intValue() <= Level.FINE.intValue();
    }

    public static Level getCurrentLevel() {
        return currentLevel;
    }

    private static void ensureInitialized() {
        if (!initialized) {
            initialize("INFO", true, false, logFileName);
        }
    }
}
