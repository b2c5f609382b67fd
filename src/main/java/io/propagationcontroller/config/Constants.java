package io.propagationcontroller.config;

/**
 * Application constants.
 */
public final class Constants {
    
    private Constants() {
        // Utility class
    }
    
    // Default configuration values
    public static final String DEFAULT_SCHEDULER_NAME = "default-scheduler";
    public static final String DEFAULT_CONTROLLER_ID = "propagation-controller";
    public static final boolean DEFAULT_COUNT_EMPTY_KEY_UNIT = true;
    
    // Unit ranking strategies
    public static final String UNIT_RANKING_LEXICOGRAPHIC = "lexicographic";
    public static final String UNIT_RANKING_CLUSTER_COUNT = "cluster-count";
    public static final String DEFAULT_UNIT_RANKING = UNIT_RANKING_LEXICOGRAPHIC;
    
    // Reserved key of the unit holding clusters that lack the spread field or label
    public static final String EMPTY_UNIT_KEY = "";
    
    // API paths
    public static final String PATH_PLACEMENT = "/_placement";
    public static final String PATH_RESOLVE = "/resolve";
    public static final String PATH_BATCH = "/_batch";
}
