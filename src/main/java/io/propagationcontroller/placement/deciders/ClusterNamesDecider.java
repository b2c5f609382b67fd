package io.propagationcontroller.placement.deciders;

import io.propagationcontroller.enums.Decision;
import io.propagationcontroller.models.ClusterAffinity;
import io.propagationcontroller.models.ClusterDescriptor;
import io.propagationcontroller.models.Toleration;

import java.util.List;

/**
 * Only allows clusters on the affinity's allow-list. An empty allow-list allows every cluster.
 */
public class ClusterNamesDecider implements ClusterDecider {
    
    @Override
    public Decision canPlace(ClusterDescriptor cluster, ClusterAffinity affinity, List<Toleration> tolerations) {
        if (affinity == null || affinity.getClusterNames() == null || affinity.getClusterNames().isEmpty()) {
            return Decision.YES;
        }
        return affinity.getClusterNames().contains(cluster.getName()) ? Decision.YES : Decision.NO;
    }
    
    @Override
    public String getName() { return "ClusterNamesDecider"; }
}
