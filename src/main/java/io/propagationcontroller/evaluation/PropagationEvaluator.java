package io.propagationcontroller.evaluation;

import io.propagationcontroller.metrics.MetricsProvider;
import io.propagationcontroller.models.ClusterDescriptor;
import io.propagationcontroller.models.PlacementResult;
import io.propagationcontroller.models.PolicyMetadata;
import io.propagationcontroller.models.PropagationDecision;
import io.propagationcontroller.models.PropagationPolicy;
import io.propagationcontroller.models.PropagationPolicyList;
import io.propagationcontroller.models.PropagationSpec;
import io.propagationcontroller.models.ResourceDescriptor;
import io.propagationcontroller.placement.PlacementResolver;
import io.propagationcontroller.selector.ResourceSelectorMatcher;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Evaluates propagation policies against inventory snapshots.
 * 
 * For one policy:
 * - a policy naming another scheduler is returned unscheduled, with nothing matched or placed
 * - the resource selectors run over the resource inventory
 * - the placement runs over the cluster inventory
 * 
 * Resource matching and placement are independent; the dispatcher combines them.
 * The evaluator holds only configuration and is safe to call concurrently.
 */
@Slf4j
public class PropagationEvaluator {
    
    private final ResourceSelectorMatcher resourceSelectorMatcher;
    private final PlacementResolver placementResolver;
    private final MetricsProvider metricsProvider;
    private final String schedulerName;
    
    public PropagationEvaluator(ResourceSelectorMatcher resourceSelectorMatcher,
                                PlacementResolver placementResolver,
                                MetricsProvider metricsProvider,
                                String schedulerName) {
        this.resourceSelectorMatcher = resourceSelectorMatcher;
        this.placementResolver = placementResolver;
        this.metricsProvider = metricsProvider;
        this.schedulerName = schedulerName;
    }
    
    /**
     * Evaluate one policy.
     * 
     * @param policy the policy, must carry a spec
     * @param clusters point-in-time cluster inventory
     * @param resources point-in-time resource inventory
     * @return what to propagate and where
     * @throws IllegalArgumentException if the policy or its spec is missing
     */
    public PropagationDecision evaluate(PropagationPolicy policy, List<ClusterDescriptor> clusters,
                                        List<ResourceDescriptor> resources) {
        if (policy == null || policy.getSpec() == null) {
            throw new IllegalArgumentException("Propagation policy and its spec are required");
        }
        
        long start = System.nanoTime();
        PropagationSpec spec = policy.getSpec();
        PolicyMetadata metadata = policy.getMetadata();
        List<ClusterDescriptor> clusterSnapshot = clusters != null ? clusters : List.of();
        List<ResourceDescriptor> resourceSnapshot = resources != null ? resources : List.of();
        
        PropagationDecision.PropagationDecisionBuilder decision = PropagationDecision.builder()
            .policyName(metadata != null ? metadata.getName() : null)
            .policyNamespace(metadata != null ? metadata.getNamespace() : null);
        
        if (!isOwnedByThisScheduler(spec)) {
            log.info("Policy {} is handled by scheduler '{}', not '{}', skipping", 
                    policy.qualifiedName(), spec.getSchedulerName(), schedulerName);
            metricsProvider.recordForeignScheduler(policy, spec.getSchedulerName());
            return decision
                .scheduled(false)
                .matchedResources(List.of())
                .placement(PlacementResult.empty())
                .build();
        }
        
        if (spec.isAssociation()) {
            log.debug("Policy {} requests association, related resources are discovered by the dispatcher", 
                     policy.qualifiedName());
        }
        
        List<ResourceDescriptor> matched = resourceSelectorMatcher.matchResources(spec, resourceSnapshot);
        PlacementResult placement = placementResolver.resolve(spec, clusterSnapshot);
        
        PropagationDecision result = decision
            .scheduled(true)
            .matchedResources(matched)
            .placement(placement)
            .build();
        
        metricsProvider.recordEvaluation(policy, result, Duration.ofNanos(System.nanoTime() - start));
        log.info("Policy {} matched {} resources, placed on {} clusters{}", 
                policy.qualifiedName(), matched.size(), placement.getSelectedClusters().size(),
                placement.isAllConstraintsSatisfied() ? "" : " (some spread constraints unsatisfied)");
        return result;
    }
    
    /**
     * Evaluate every policy of a list against the same snapshots, preserving list order.
     */
    public List<PropagationDecision> evaluateAll(PropagationPolicyList policies, List<ClusterDescriptor> clusters,
                                                 List<ResourceDescriptor> resources) {
        if (policies == null || policies.getItems() == null) {
            return List.of();
        }
        return policies.getItems().stream()
            .map(policy -> evaluate(policy, clusters, resources))
            .collect(Collectors.toList());
    }
    
    private boolean isOwnedByThisScheduler(PropagationSpec spec) {
        String requested = spec.getSchedulerName();
        return requested == null || requested.isBlank() || requested.equals(schedulerName);
    }
    
    public String getSchedulerName() {
        return schedulerName;
    }
}
