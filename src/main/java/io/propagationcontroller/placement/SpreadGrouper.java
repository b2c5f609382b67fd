package io.propagationcontroller.placement;

import io.propagationcontroller.enums.ClusterField;
import io.propagationcontroller.models.ClusterDescriptor;
import io.propagationcontroller.models.SpreadConstraint;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import static io.propagationcontroller.config.Constants.EMPTY_UNIT_KEY;

/**
 * Partitions clusters into units for a spread constraint.
 * 
 * Key concept: UNIT KEY is the value of the constraint's field (spreadByField) or
 * label (spreadByLabel) on each cluster. All clusters sharing a key form one unit.
 * 
 * Clusters without the field or label are kept in the reserved empty-key unit.
 * Units iterate in lexicographic key order and clusters within a unit are sorted by name,
 * so repeated runs over the same snapshot produce identical groupings.
 */
@Slf4j
public class SpreadGrouper {
    
    /**
     * Group clusters by the key named in the constraint. The constraint must have passed
     * {@link SpreadConstraintValidator}.
     */
    public SortedMap<String, List<ClusterDescriptor>> group(List<ClusterDescriptor> clusters, SpreadConstraint constraint) {
        SortedMap<String, List<ClusterDescriptor>> units = new TreeMap<>();
        
        ClusterField field = constraint.hasSpreadByField() ? ClusterField.fromString(constraint.getSpreadByField()) : null;
        if (constraint.hasSpreadByField() && field == null) {
            log.warn("Unknown spread field '{}', every cluster falls into the empty-key unit", 
                    constraint.getSpreadByField());
        }
        
        for (ClusterDescriptor cluster : clusters) {
            String key = unitKey(cluster, constraint, field);
            units.computeIfAbsent(key, k -> new ArrayList<>()).add(cluster);
        }
        
        units.values().forEach(members -> 
            members.sort(Comparator.comparing(ClusterDescriptor::getName, Comparator.nullsFirst(Comparator.naturalOrder()))));
        
        log.debug("Grouped {} clusters into {} units by {}", clusters.size(), units.size(), describe(constraint));
        return units;
    }
    
    private String unitKey(ClusterDescriptor cluster, SpreadConstraint constraint, ClusterField field) {
        String value;
        if (constraint.hasSpreadByField()) {
            value = field != null ? field.extract(cluster) : null;
        } else {
            value = cluster.getLabels() != null ? cluster.getLabels().get(constraint.getSpreadByLabel()) : null;
        }
        return value != null ? value : EMPTY_UNIT_KEY;
    }
    
    static String describe(SpreadConstraint constraint) {
        return constraint.hasSpreadByField()
            ? "field '" + constraint.getSpreadByField() + "'"
            : "label '" + constraint.getSpreadByLabel() + "'";
    }
}
