package io.propagationcontroller.placement;

import io.propagationcontroller.enums.Decision;
import io.propagationcontroller.models.ClusterAffinity;
import io.propagationcontroller.models.ClusterDescriptor;
import io.propagationcontroller.models.Toleration;
import io.propagationcontroller.placement.deciders.ClusterDecider;
import io.propagationcontroller.placement.deciders.ClusterNamesDecider;
import io.propagationcontroller.placement.deciders.ExcludeClustersDecider;
import io.propagationcontroller.placement.deciders.FieldSelectorDecider;
import io.propagationcontroller.placement.deciders.LabelSelectorDecider;
import io.propagationcontroller.placement.deciders.TaintTolerationDecider;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Cluster filter that chains ClusterDeciders in a fixed order.
 * 
 * Default order: exclude list, cluster name allow-list, label selector, field selector,
 * taint toleration. Evaluation stops at the first NO.
 * When the policy declares no affinity only the taint toleration decider runs.
 */
@Slf4j
public class ClusterFilter {
    
    private final List<ClusterDecider> affinityDeciders;
    private final ClusterDecider tolerationDecider;
    
    public ClusterFilter() {
        this(List.of(
                new ExcludeClustersDecider(),
                new ClusterNamesDecider(),
                new LabelSelectorDecider(),
                new FieldSelectorDecider()),
            new TaintTolerationDecider());
    }
    
    public ClusterFilter(List<ClusterDecider> affinityDeciders, ClusterDecider tolerationDecider) {
        this.affinityDeciders = List.copyOf(affinityDeciders);
        this.tolerationDecider = tolerationDecider;
    }
    
    /**
     * Check whether a cluster is eligible for placement.
     */
    public boolean isEligible(ClusterDescriptor cluster, Optional<ClusterAffinity> affinity, List<Toleration> tolerations) {
        return evaluate(cluster, affinity, tolerations).isEligible();
    }
    
    /**
     * Evaluate a cluster and report which decider rejected it, if any.
     */
    public FilterOutcome evaluate(ClusterDescriptor cluster, Optional<ClusterAffinity> affinity, List<Toleration> tolerations) {
        List<Toleration> safeTolerations = tolerations != null ? tolerations : List.of();
        
        if (affinity.isPresent()) {
            for (ClusterDecider decider : affinityDeciders) {
                Decision decision = decider.canPlace(cluster, affinity.get(), safeTolerations);
                if (decision == Decision.NO) {
                    log.debug("Cluster {} rejected by {}", cluster.getName(), decider.getName());
                    return FilterOutcome.rejectedBy(decider.getName());
                }
            }
        }
        
        if (tolerationDecider.canPlace(cluster, affinity.orElse(null), safeTolerations) == Decision.NO) {
            log.debug("Cluster {} rejected by {}", cluster.getName(), tolerationDecider.getName());
            return FilterOutcome.rejectedBy(tolerationDecider.getName());
        }
        
        return FilterOutcome.ELIGIBLE;
    }
    
    /**
     * Names of the deciders in evaluation order.
     */
    public List<String> getDeciderNames() {
        List<String> names = affinityDeciders.stream()
            .map(ClusterDecider::getName)
            .collect(Collectors.toList());
        names.add(tolerationDecider.getName());
        return names;
    }
    
    /**
     * Result of filtering one cluster.
     */
    @Getter
    @AllArgsConstructor
    public static class FilterOutcome {
        
        static final FilterOutcome ELIGIBLE = new FilterOutcome(true, null);
        
        private final boolean eligible;
        
        /**
         * Name of the rejecting decider, null when eligible
         */
        private final String rejectedBy;
        
        static FilterOutcome rejectedBy(String deciderName) {
            return new FilterOutcome(false, deciderName);
        }
    }
}
