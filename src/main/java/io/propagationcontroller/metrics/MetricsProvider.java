package io.propagationcontroller.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.propagationcontroller.models.PropagationDecision;
import io.propagationcontroller.models.PropagationPolicy;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static io.propagationcontroller.metrics.MetricsConstants.FOREIGN_SCHEDULER_POLICIES_METRIC_NAME;
import static io.propagationcontroller.metrics.MetricsConstants.MATCHED_RESOURCES_METRIC_NAME;
import static io.propagationcontroller.metrics.MetricsConstants.POLICY_EVALUATION_LATENCY_METRIC_NAME;
import static io.propagationcontroller.metrics.MetricsConstants.SELECTED_CLUSTERS_METRIC_NAME;
import static io.propagationcontroller.metrics.MetricsConstants.UNSATISFIED_SPREAD_CONSTRAINTS_METRIC_NAME;

/*
 * MetricsProvider records policy evaluation metrics: latency timers, matched resource and
 * selected cluster gauges, and counters for unsatisfied constraints and foreign-scheduler policies.
 * Every meter is tagged with the controller id from PropagationControllerConfig.
 */
@Slf4j
public class MetricsProvider {
    private static final double[] TIMER_PERCENTILES = {0.5, 0.9, 0.99};
    private static final String CONTROLLER_ID_TAG = "controllerId";

    private final MeterRegistry registry;
    private final String controllerId;
    private final Map<String, AtomicDouble> gaugeCache = new ConcurrentHashMap<>();

    public MetricsProvider(MeterRegistry registry, String controllerId) {
        this.registry = registry;
        this.controllerId = controllerId;
        log.info("MetricsProvider initialized for the controller: {}", controllerId);
    }

    /**
     * Records the outcome of one policy evaluation.
     *
     * @param policy the evaluated policy
     * @param decision the decision produced for it
     * @param elapsed wall time spent evaluating
     */
    public void recordEvaluation(PropagationPolicy policy, PropagationDecision decision, Duration elapsed) {
        Map<String, String> tags = MetricsUtils.buildPolicyTags(policy);
        timer(POLICY_EVALUATION_LATENCY_METRIC_NAME, tags).record(elapsed);

        int matched = decision.getMatchedResources() != null ? decision.getMatchedResources().size() : 0;
        gauge(MATCHED_RESOURCES_METRIC_NAME, matched, MetricsUtils.buildPolicyTags(policy));

        if (decision.getPlacement() == null) {
            return;
        }
        gauge(SELECTED_CLUSTERS_METRIC_NAME, decision.getPlacement().getSelectedClusters().size(),
            MetricsUtils.buildPolicyTags(policy));

        long unsatisfied = decision.getPlacement().getConstraintDiagnostics().stream()
            .filter(diagnostic -> !diagnostic.isSatisfied())
            .count();
        if (unsatisfied > 0) {
            counter(UNSATISFIED_SPREAD_CONSTRAINTS_METRIC_NAME, MetricsUtils.buildPolicyTags(policy)).increment(unsatisfied);
        }
    }

    /**
     * Counts a policy left alone because it names another scheduler.
     */
    public void recordForeignScheduler(PropagationPolicy policy, String schedulerName) {
        counter(FOREIGN_SCHEDULER_POLICIES_METRIC_NAME, MetricsUtils.buildSchedulerTags(policy, schedulerName)).increment();
    }

    /**
     * Creates or retrieves a Counter metric with the given name and tags.
     *
     * @param name the name of the counter
     * @param tags a mutable map of tag keys to tag values
     * @return the Counter instance
     */
    public Counter counter(String name, Map<String, String> tags) {
        tags.put(CONTROLLER_ID_TAG, controllerId);
        return Counter.builder(name).tags(mapToTagArray(tags)).register(registry);
    }

    /**
     * Gets or creates a Gauge metric and sets its value.
     * Identical name+tags combinations share one AtomicDouble.
     *
     * @param name the name of the gauge
     * @param value the new value of the gauge
     * @param tags a mutable map of tag keys to tag values
     * @return the AtomicDouble backing the gauge
     */
    public AtomicDouble gauge(String name, double value, Map<String, String> tags) {
        tags.put(CONTROLLER_ID_TAG, controllerId);
        String cacheKey = buildCacheKey(name, tags);
        AtomicDouble gauge = gaugeCache.computeIfAbsent(cacheKey, k -> {
            AtomicDouble gaugeValue = new AtomicDouble(value);
            Gauge.builder(name, gaugeValue::get)
                .tags(mapToTagArray(tags))
                .register(registry);
            return gaugeValue;
        });
        gauge.set(value);
        return gauge;
    }

    /**
     * Creates or retrieves a Timer metric with the given name and tags.
     *
     * @param name the name of the timer
     * @param tags a mutable map of tag keys to tag values
     * @return the Timer instance
     */
    public Timer timer(String name, Map<String, String> tags) {
        tags.put(CONTROLLER_ID_TAG, controllerId);
        return Timer.builder(name)
            .tags(mapToTagArray(tags))
            .publishPercentiles(TIMER_PERCENTILES)
            .register(registry);
    }

    private String buildCacheKey(String name, Map<String, String> tags) {
        StringBuilder key = new StringBuilder(name);
        tags.entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .forEach(e -> key.append(":").append(e.getKey()).append("=").append(e.getValue()));
        return key.toString();
    }

    private String[] mapToTagArray(Map<String, String> tags) {
        String[] tagArray = new String[tags.size() * 2];
        int index = 0;
        for (Map.Entry<String, String> entry : tags.entrySet()) {
            tagArray[index++] = entry.getKey();
            tagArray[index++] = entry.getValue();
        }
        return tagArray;
    }
}
