package planner.config;

public class PlannerConfig {
    public static final int DEFAULT_MAX_CANDIDATES = 1000;
    public static final int DEFAULT_PARALLELISM = 1;

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 5;
    public static final int DEFAULT_PRIORITY = 3;
    public static final int DEFAULT_CREDITS = 0;
}
