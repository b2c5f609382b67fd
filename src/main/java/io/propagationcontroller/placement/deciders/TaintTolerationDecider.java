package io.propagationcontroller.placement.deciders;

import io.propagationcontroller.enums.Decision;
import io.propagationcontroller.models.ClusterAffinity;
import io.propagationcontroller.models.ClusterDescriptor;
import io.propagationcontroller.models.Taint;
import io.propagationcontroller.models.Toleration;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Decider that rejects clusters carrying a taint that no policy toleration tolerates.
 * PreferNoSchedule taints never reject a cluster. A taint with a missing or
 * unrecognized effect is treated as blocking.
 */
@Slf4j
public class TaintTolerationDecider implements ClusterDecider {
    
    @Override
    public Decision canPlace(ClusterDescriptor cluster, ClusterAffinity affinity, List<Toleration> tolerations) {
        if (cluster.getTaints() == null || cluster.getTaints().isEmpty()) {
            return Decision.YES;
        }
        
        for (Taint taint : cluster.getTaints()) {
            if (taint.getEffect() != null && !taint.getEffect().isBlocking()) {
                continue;
            }
            boolean tolerated = tolerations.stream().anyMatch(t -> t.tolerates(taint));
            if (!tolerated) {
                log.debug("TaintToleration: cluster {} has untolerated taint {}={}:{}", 
                         cluster.getName(), taint.getKey(), taint.getValue(), taint.getEffect());
                return Decision.NO;
            }
        }
        return Decision.YES;
    }
    
    @Override
    public String getName() { return "TaintTolerationDecider"; }
}
