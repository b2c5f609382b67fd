package io.propagationcontroller.metrics;

/**
 * Constants for metrics names and tags used in the Propagation Controller.
 */
public class MetricsConstants {
    public final static String POLICY_EVALUATION_LATENCY_METRIC_NAME = "policy_evaluation_latency";
    public final static String MATCHED_RESOURCES_METRIC_NAME = "policy_matched_resources";
    public final static String SELECTED_CLUSTERS_METRIC_NAME = "policy_selected_clusters";
    public final static String UNSATISFIED_SPREAD_CONSTRAINTS_METRIC_NAME = "unsatisfied_spread_constraints_count";
    public final static String FOREIGN_SCHEDULER_POLICIES_METRIC_NAME = "foreign_scheduler_policies_count";
    public final static String POLICY_NAME_TAG = "policyName";
    public final static String POLICY_NAMESPACE_TAG = "policyNamespace";
    public final static String SCHEDULER_NAME_TAG = "schedulerName";

    private MetricsConstants() {}
}
