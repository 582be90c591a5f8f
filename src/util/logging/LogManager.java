package util.logging;

import driver.Config;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Manager for creating and configuring Logger instances
 */
public class LogManager {
    private static final String LOG_DIRECTORY = "logs";
    private static final Map<String, Logger> loggers = new ConcurrentHashMap<>();
    private static LogLevel rootLevel = LogLevel.INFO;
    private static boolean initialized = false;

    private static boolean consoleEnabled = false;
    private static boolean fileEnabled = false;
    private static PrintWriter fileWriter;
    private static final Object FILE_LOCK = new Object();

    // name of the translation unit being structured, prefixed to every record
    private static volatile String context = null;

    private LogManager() {
        // Private constructor to prevent instantiation
    }

    /**
     * Get a logger for the specified class
     * @param clazz The class requesting the logger
     * @return A Logger instance
     */
    public static Logger getLogger(Class<?> clazz) {
        return getLogger(clazz.getName(), null);
    }

    public static Logger getLogger(Class<?> clazz, LogLevel level) {
        return getLogger(clazz.getName(), level);
    }

    /**
     * Get a logger for the specified name. A null level makes the logger
     * follow the root level.
     */
    public static synchronized Logger getLogger(String name, LogLevel level) {
        if (!initialized) {
            init();
        }

        return loggers.computeIfAbsent(name, n -> new SimpleLogger(n, level));
    }

    /**
     * Initialize the logging system
     */
    public static synchronized void init() {
        if (initialized) {
            return;
        }

        Config config = Config.getInstance();
        if (config.isDebug) {
            rootLevel = LogLevel.DEBUG;
        }
        rootLevel = LogLevel.parse(System.getProperty("log.level"), rootLevel);
        consoleEnabled = config.logToConsole;
        fileEnabled = config.logToFile;

        if (fileEnabled) {
            openFile();
        }

        initialized = true;
    }

    private static void openFile() {
        File logDir = new File(LOG_DIRECTORY);
        if (!logDir.exists() && !logDir.mkdirs()) {
            System.err.println("Cannot create log directory " + logDir.getAbsolutePath());
            fileEnabled = false;
            return;
        }

        try {
            File logFile = new File(logDir, "refine" + System.currentTimeMillis() + ".log");
            fileWriter = new PrintWriter(new FileWriter(logFile, true), true);
        } catch (IOException e) {
            System.err.println("Cannot open log file: " + e.getMessage());
            fileEnabled = false;
        }
    }

    public static synchronized void setRootLevel(LogLevel level) {
        rootLevel = level;
    }

    public static synchronized LogLevel getRootLevel() {
        return rootLevel;
    }

    public static void setContext(String name) {
        context = name;
    }

    public static String getContext() {
        return context;
    }

    /**
     * Write log message to configured appenders
     * @param level Log level of the message
     * @param message The formatted log message
     */
    static void writeLog(LogLevel level, String message) {
        if (consoleEnabled) {
            if (level.getValue() >= LogLevel.WARN.getValue()) {
                System.err.println(message);
            } else {
                System.out.println(message);
            }
        }

        if (fileEnabled) {
            synchronized (FILE_LOCK) {
                if (fileWriter != null) {
                    fileWriter.println(message);
                }
            }
        }
    }

    public static void enableConsole() {
        consoleEnabled = true;
    }

    public static void disableConsole() {
        consoleEnabled = false;
    }

    public static synchronized void enableFile() {
        fileEnabled = true;
        synchronized (FILE_LOCK) {
            if (fileWriter == null) {
                openFile();
            }
        }
    }

    public static void disableFile() {
        fileEnabled = false;
        synchronized (FILE_LOCK) {
            if (fileWriter != null) {
                fileWriter.close();
                fileWriter = null;
            }
        }
    }

    public static void disableAll() {
        disableConsole();
        disableFile();
    }

    /**
     * Shutdown the logging system and close all resources
     */
    public static void shutdown() {
        synchronized (FILE_LOCK) {
            if (fileWriter != null) {
                fileWriter.close();
                fileWriter = null;
            }
        }
    }
}
