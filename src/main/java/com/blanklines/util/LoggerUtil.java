package com.blanklines.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.logging.*;

/**
 * Configures the checker's loggers. Every logger lives under {@code com.blanklines},
 * whose level follows the most verbose handler in use so that console and log
 * file output are not cut off by the logger itself.
 */
public class LoggerUtil {
    private static final String LOG_CONFIG = "/logging.properties";
    private static final String BASE_LOGGER_NAME = "com.blanklines";

    // Strong reference; LogManager only keeps loggers weakly
    private static final Logger baseLogger = Logger.getLogger(BASE_LOGGER_NAME);

    private static boolean initialized = false;
    private static Level consoleLevel = Level.WARNING;
    private static FileHandler fileHandler;

    /**
     * Reads {@code /logging.properties} from the classpath once.
     */
    public static synchronized void initialize() {
        if (initialized) {
            return;
        }
        initialized = true;

        try (InputStream is = LoggerUtil.class.getResourceAsStream(LOG_CONFIG)) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            }
        } catch (IOException | SecurityException e) {
            System.err.println("Failed to initialize logging: " + e.getMessage());
        }
    }

    /**
     * Sets the level of the console handlers and opens the checker loggers up to it.
     */
    public static synchronized void setConsoleLevel(Level level) {
        initialize();
        consoleLevel = level;

        for (Handler handler : Logger.getLogger("").getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }
        _updateBaseLevel();
    }

    /**
     * Appends every checker log record, down to {@code FINE}, to the given file.
     */
    public static synchronized void openLogFile(Path path) throws IOException {
        initialize();
        closeLogFile();

        FileHandler handler = new FileHandler(path.toString(), true);
        handler.setLevel(Level.FINE);
        handler.setFormatter(new SimpleFormatter());
        baseLogger.addHandler(handler);
        fileHandler = handler;

        _updateBaseLevel();
    }

    public static synchronized void closeLogFile() {
        if (fileHandler != null) {
            baseLogger.removeHandler(fileHandler);
            fileHandler.close();
            fileHandler = null;
            _updateBaseLevel();
        }
    }

    private static void _updateBaseLevel() {
        Level level = Level.INFO;
        if (consoleLevel.intValue() < level.intValue()) {
            level = consoleLevel;
        }
        if (fileHandler != null && fileHandler.getLevel().intValue() < level.intValue()) {
            level = fileHandler.getLevel();
        }
        baseLogger.setLevel(level);
    }

    public static Logger getLogger(Class<?> clazz) {
        return getLogger(clazz.getName());
    }

    public static Logger getLogger(String name) {
        if (!initialized) {
            initialize();
        }
        return Logger.getLogger(name);
    }

    /**
     * Flushes and closes all handlers.
     */
    public static synchronized void shutdown() {
        closeLogFile();
        for (Handler handler : Logger.getLogger("").getHandlers()) {
            handler.close();
        }
    }
}
