package com.sysmuse.fuzzy.util;

import com.sysmuse.fuzzy.ParserConfig;

import java.io.IOException;
import java.util.logging.*;

/**
 * Centralized logging for the fuzzy calculator.
 * Thin static wrapper around java.util.logging so that pipeline stages
 * never deal with handlers or levels themselves.
 */
public class LoggingUtil {
    public enum ConsoleOutputMode {
        ALL_TO_OUT,
        ALL_TO_ERR,
        SPLIT_SEVERE_TO_ERR
    }

    private static final Logger logger = Logger.getLogger("com.sysmuse.fuzzy");
    private static boolean initialized = false;
    private static Level currentLevel = Level.INFO;
    private static boolean fileLogging = false;
    private static String logFileName = "fuzzy-calculator.log";
    private static ConsoleOutputMode consoleOutputMode = ConsoleOutputMode.SPLIT_SEVERE_TO_ERR;

    private static class FlushingHandler extends StreamHandler {
        FlushingHandler(java.io.OutputStream out, Level level) {
            super(out, new SimpleFormatter());
            setLevel(level);
        }

        @Override
        public synchronized void publish(LogRecord record) {
            super.publish(record);
            flush();
        }
    }

    public static void setConsoleOutputMode(ConsoleOutputMode mode) {
        consoleOutputMode = mode;
    }

    /**
     * Initialize logging from the parser configuration.
     * Later calls are ignored unless {@link #reset()} was called in between.
     */
    public static void initialize(ParserConfig config) {
        initialize(config.getLoggingLevel(),
                config.isConsoleLoggingEnabled(),
                config.isFileLoggingEnabled(),
                config.getLogFileName());
    }

    public static synchronized void initialize(String levelStr, boolean consoleEnabled, boolean fileEnabled, String fileName) {
        if (initialized) {
            return;
        }

        currentLevel = parseLevel(levelStr);
        clearHandlers();

        if (consoleEnabled) {
            setupConsoleHandlers();
        }

        if (fileEnabled && fileName != null && !fileName.isEmpty()) {
            try {
                FileHandler fileHandler = new FileHandler(fileName);
                fileHandler.setFormatter(new SimpleFormatter());
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

        debug("Logging initialized: level=" + currentLevel +
                ", console=" + consoleEnabled +
                ", file=" + (fileLogging ? logFileName : "disabled"));
    }

    /**
     * Drops the current handlers so that the next call to initialize takes effect.
     */
    public static synchronized void reset() {
        clearHandlers();
        fileLogging = false;
        initialized = false;
    }

    static Level parseLevel(String levelStr) {
        if (levelStr == null) {
            return Level.INFO;
        }
        switch (levelStr.trim().toUpperCase()) {
            case "SEVERE":
            case "ERROR":
                return Level.SEVERE;
            case "WARNING":
            case "WARN":
                return Level.WARNING;
            case "DEBUG":
                return Level.FINE;
            case "TRACE":
                return Level.FINEST;
            default:
                return Level.INFO;
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
                logger.addHandler(new FlushingHandler(System.out, currentLevel));
                break;
            case ALL_TO_ERR:
                logger.addHandler(new FlushingHandler(System.err, currentLevel));
                break;
            case SPLIT_SEVERE_TO_ERR:
                FlushingHandler out = new FlushingHandler(System.out, currentLevel);
                out.setFilter(record -> record.getLevel().intValue() < Level.SEVERE.intValue());
                logger.addHandler(out);
                logger.addHandler(new FlushingHandler(System.err, Level.SEVERE));
                break;
        }
    }

    public static void debug(String message) {
        ensureInitialized();
        logger.fine(message);
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

    public static Level getLevel() {
        return currentLevel;
    }

    private static void ensureInitialized() {
        if (!initialized) {
            initialize("INFO", true, false, null);
        }
    }
}
