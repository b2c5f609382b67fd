package io.propagationcontroller.metrics;

import io.propagationcontroller.models.PolicyMetadata;
import io.propagationcontroller.models.PropagationPolicy;

import java.util.HashMap;
import java.util.Map;

import static io.propagationcontroller.metrics.MetricsConstants.POLICY_NAMESPACE_TAG;
import static io.propagationcontroller.metrics.MetricsConstants.POLICY_NAME_TAG;
import static io.propagationcontroller.metrics.MetricsConstants.SCHEDULER_NAME_TAG;

/**
 * Utility class for handling metrics.
 */
public class MetricsUtils {
    
    private static final String UNKNOWN = "unknown";
    
    /**
     * Builds a map of metrics tags including policy name and namespace.
     *
     * @param policy the evaluated policy
     * @return a mutable map of metrics tags
     */
    public static Map<String, String> buildPolicyTags(PropagationPolicy policy) {
        PolicyMetadata metadata = policy.getMetadata();
        Map<String, String> tags = new HashMap<>();
        tags.put(POLICY_NAME_TAG, valueOrUnknown(metadata != null ? metadata.getName() : null));
        tags.put(POLICY_NAMESPACE_TAG, valueOrUnknown(metadata != null ? metadata.getNamespace() : null));
        return tags;
    }
    
    /**
     * Builds a map of metrics tags including policy name, namespace and the scheduler it names.
     */
    public static Map<String, String> buildSchedulerTags(PropagationPolicy policy, String schedulerName) {
        Map<String, String> tags = buildPolicyTags(policy);
        tags.put(SCHEDULER_NAME_TAG, valueOrUnknown(schedulerName));
        return tags;
    }
    
    private static String valueOrUnknown(String value) {
        return value == null || value.isEmpty() ? UNKNOWN : value;
    }
}
