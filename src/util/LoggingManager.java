package util;

import util.logging.LogLevel;
import util.logging.LogManager;
import util.logging.Logger;
import driver.Config;

/**
 * Entry point the passes use to obtain loggers
 */
public class LoggingManager {
    private static boolean inited = false;

    public static void init() {
        if (inited) return;

        LogManager.init();

        if (Config.getInstance().isDebug) {
            LogManager.setRootLevel(LogLevel.DEBUG);
        }

        inited = true;
    }

    public static Logger getLogger(Class<?> cls) {
        if (!inited) init();
        return LogManager.getLogger(cls);
    }

    public static Logger getLogger(Class<?> cls, LogLevel level) {
        if (!inited) init();
        return LogManager.getLogger(cls, level);
    }

    /**
     * Tag subsequent records with the name of the unit being structured.
     */
    public static void setUnit(String unitName) {
        LogManager.setContext(unitName);
    }
}
