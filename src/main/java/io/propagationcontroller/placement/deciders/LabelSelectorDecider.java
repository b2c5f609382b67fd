package io.propagationcontroller.placement.deciders;

import io.propagationcontroller.enums.Decision;
import io.propagationcontroller.models.ClusterAffinity;
import io.propagationcontroller.models.ClusterDescriptor;
import io.propagationcontroller.models.LabelSelector;
import io.propagationcontroller.models.Toleration;
import io.propagationcontroller.selector.LabelSelectorMatcher;

import java.util.List;
import java.util.Optional;

/**
 * Decider that filters clusters by the affinity's label selector.
 * 
 * An absent selector or an empty selector matches every cluster.
 */
public class LabelSelectorDecider implements ClusterDecider {
    
    @Override
    public Decision canPlace(ClusterDescriptor cluster, ClusterAffinity affinity, List<Toleration> tolerations) {
        if (affinity == null) {
            return Decision.YES;
        }
        Optional<LabelSelector> selector = affinity.findLabelSelector();
        if (selector.isEmpty()) {
            return Decision.YES;
        }
        return LabelSelectorMatcher.matches(selector.get(), cluster.getLabels()) ? Decision.YES : Decision.NO;
    }
    
    @Override
    public String getName() { return "LabelSelectorDecider"; }
}
