package io.propagationcontroller.placement.deciders;

import io.propagationcontroller.enums.ClusterField;
import io.propagationcontroller.enums.Decision;
import io.propagationcontroller.models.ClusterAffinity;
import io.propagationcontroller.models.ClusterDescriptor;
import io.propagationcontroller.models.FieldSelector;
import io.propagationcontroller.models.FieldSelectorRequirement;
import io.propagationcontroller.models.Toleration;
import io.propagationcontroller.selector.LabelSelectorMatcher;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decider that filters clusters by the affinity's field selector.
 * 
 * Requirements are ANDed and evaluated against the cluster's region, zone, provider
 * and name (key "cluster"). A requirement on any other key evaluates to false,
 * so the cluster is rejected rather than the evaluation failing.
 */
@Slf4j
public class FieldSelectorDecider implements ClusterDecider {
    
    @Override
    public Decision canPlace(ClusterDescriptor cluster, ClusterAffinity affinity, List<Toleration> tolerations) {
        if (affinity == null) {
            return Decision.YES;
        }
        Optional<FieldSelector> selector = affinity.findFieldSelector();
        if (selector.isEmpty() || selector.get().getMatchExpressions() == null) {
            return Decision.YES;
        }
        
        Map<String, String> fields = fieldsOf(cluster);
        for (FieldSelectorRequirement requirement : selector.get().getMatchExpressions()) {
            if (ClusterField.fromString(requirement.getKey()) == null) {
                log.debug("FieldSelector: unknown field '{}' for cluster {}, requirement does not match", 
                         requirement.getKey(), cluster.getName());
                return Decision.NO;
            }
            if (!LabelSelectorMatcher.matchesRequirement(requirement.getKey().trim().toLowerCase(),
                    requirement.getOperator(), requirement.getValues(), fields)) {
                return Decision.NO;
            }
        }
        return Decision.YES;
    }
    
    private Map<String, String> fieldsOf(ClusterDescriptor cluster) {
        Map<String, String> fields = new HashMap<>();
        for (ClusterField field : ClusterField.values()) {
            String value = field.extract(cluster);
            if (value != null && !value.isEmpty()) {
                fields.put(field.getValue(), value);
            }
        }
        return fields;
    }
    
    @Override
    public String getName() { return "FieldSelectorDecider"; }
}
