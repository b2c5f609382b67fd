package io.propagationcontroller.placement;

import io.propagationcontroller.models.ClusterDescriptor;

import java.util.List;

/**
 * Scores a cluster unit. Higher scores are preferred.
 */
@FunctionalInterface
public interface UnitScorer {
    
    /**
     * Prefers units with more clusters.
     */
    UnitScorer CLUSTER_COUNT = (unitKey, clusters) -> clusters.size();
    
    double score(String unitKey, List<ClusterDescriptor> clusters);
}
