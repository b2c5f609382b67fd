package io.propagationcontroller.placement.deciders;

import io.propagationcontroller.enums.Decision;
import io.propagationcontroller.models.ClusterAffinity;
import io.propagationcontroller.models.ClusterDescriptor;
import io.propagationcontroller.models.Toleration;

import java.util.List;

/**
 * Rejects clusters on the affinity's deny-list. Runs first so that the deny-list
 * wins over every other affinity rule.
 */
public class ExcludeClustersDecider implements ClusterDecider {
    
    @Override
    public Decision canPlace(ClusterDescriptor cluster, ClusterAffinity affinity, List<Toleration> tolerations) {
        if (affinity == null || affinity.getExcludeClusters() == null) {
            return Decision.YES;
        }
        return affinity.getExcludeClusters().contains(cluster.getName()) ? Decision.NO : Decision.YES;
    }
    
    @Override
    public String getName() { return "ExcludeClustersDecider"; }
}
