package driver;

/*
 * configuration of the structuring pipeline
 */
public class Config {
    private static Config config = new Config();

    public boolean isDebug = false;

    // mirror log records on stderr/stdout, and into logs/refine*.log
    public boolean logToConsole = false;
    public boolean logToFile = false;

    // per-query budget handed to the decision procedure, 0 means no limit
    public int solverTimeoutMs = 10_000;

    // fixpoint driver limits, 0 means unbounded
    public int maxIterations = 64;
    public long timeBudgetMs = 0;

    private Config() {
        isDebug = getFlag("debug");
        logToConsole = getFlag("log.console");
        logToFile = getFlag("log.file");
        solverTimeoutMs = getInt("solver.timeout", solverTimeoutMs);
        maxIterations = getInt("fixpoint.max", maxIterations);
        timeBudgetMs = getInt("fixpoint.budget", (int) timeBudgetMs);
    }

    /**
     * Check if a boolean system property is set to "true" (case-insensitive).
     * @param name the system property name
     * @return true if the property is exactly "true", false otherwise
     */
    public static boolean getFlag(String name) {
        String raw = System.getProperty(name);
        return raw != null && raw.equalsIgnoreCase("true");
    }

    /**
     * Read a non-negative integer system property.
     * @param name the system property name
     * @param fallback value used when the property is absent or malformed
     */
    public static int getInt(String name, int fallback) {
        String raw = System.getProperty(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return value < 0 ? fallback : value;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public static Config getInstance() {
        return config;
    }
}
