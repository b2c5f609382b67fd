package io.propagationcontroller.placement.deciders;

import io.propagationcontroller.enums.Decision;
import io.propagationcontroller.models.ClusterAffinity;
import io.propagationcontroller.models.ClusterDescriptor;
import io.propagationcontroller.models.Toleration;

import java.util.List;

/**
 * Interface for cluster eligibility decisions.
 * 
 * Each ClusterDecider implements one rule for determining whether resources
 * can be placed on a member cluster. Deciders hold no per-evaluation state and
 * may be shared across threads.
 */
public interface ClusterDecider {
    
    /**
     * Determine if resources can be placed on a cluster.
     * 
     * @param cluster the candidate cluster
     * @param affinity the policy's cluster affinity, null when the policy declares none
     * @param tolerations the policy's cluster tolerations, never null
     * @return placement decision
     */
    Decision canPlace(ClusterDescriptor cluster, ClusterAffinity affinity, List<Toleration> tolerations);
    
    /**
     * Get the name of this decider.
     */
    String getName();
}
