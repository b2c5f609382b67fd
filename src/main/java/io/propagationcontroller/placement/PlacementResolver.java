package io.propagationcontroller.placement;

import io.propagationcontroller.enums.ExclusionStage;
import io.propagationcontroller.models.ClusterAffinity;
import io.propagationcontroller.models.ClusterDescriptor;
import io.propagationcontroller.models.ClusterExclusion;
import io.propagationcontroller.models.ConstraintDiagnostic;
import io.propagationcontroller.models.Placement;
import io.propagationcontroller.models.PlacementResult;
import io.propagationcontroller.models.PropagationSpec;
import io.propagationcontroller.models.SpreadConstraint;
import io.propagationcontroller.models.Toleration;
import io.propagationcontroller.models.UnitSelection;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.stream.Collectors;

import static io.propagationcontroller.config.Constants.EMPTY_UNIT_KEY;

/**
 * Resolves a policy's placement against a cluster inventory snapshot.
 * 
 * Steps:
 * 1. Filter every candidate through the ClusterFilter, producing the eligible set E0
 * 2. Fold over the spread constraints in declared order: group E(i-1) into units,
 *    select units, and keep only clusters of selected units as E(i)
 * 3. Without spread constraints the eligible set is the result
 * 
 * A structurally invalid constraint is skipped (the cluster set passes through unchanged)
 * and reported in the diagnostics. An empty result is valid and never raises.
 * The resolver keeps no state between calls and never mutates its inputs.
 */
@Slf4j
public class PlacementResolver {
    
    private final ClusterFilter clusterFilter;
    private final SpreadGrouper spreadGrouper;
    private final UnitSelector unitSelector;
    
    public PlacementResolver() {
        this(new ClusterFilter(), new SpreadGrouper(), new UnitSelector());
    }
    
    public PlacementResolver(ClusterFilter clusterFilter, SpreadGrouper spreadGrouper, UnitSelector unitSelector) {
        this.clusterFilter = clusterFilter;
        this.spreadGrouper = spreadGrouper;
        this.unitSelector = unitSelector;
    }
    
    public PlacementResult resolve(PropagationSpec spec, List<ClusterDescriptor> clusters) {
        Placement placement = spec.getPlacement() != null ? spec.getPlacement() : new Placement();
        List<ClusterExclusion> exclusions = new ArrayList<>();
        
        List<ClusterDescriptor> eligible = filterClusters(placement, clusters, exclusions);
        log.debug("{} of {} clusters eligible after cluster filter", eligible.size(), clusters.size());
        
        List<ConstraintDiagnostic> diagnostics = new ArrayList<>();
        List<SpreadConstraint> constraints = placement.getSpreadConstraints() != null 
            ? placement.getSpreadConstraints() : List.of();
        
        List<ClusterDescriptor> current = eligible;
        for (int i = 0; i < constraints.size(); i++) {
            SpreadConstraint constraint = constraints.get(i);
            try {
                SpreadConstraintValidator.validate(i, constraint);
            } catch (InvalidSpreadConstraintException e) {
                log.warn("Skipping spread constraint: {}", e.getMessage());
                diagnostics.add(ConstraintDiagnostic.builder()
                    .constraintIndex(i)
                    .selectedUnits(List.of())
                    .clustersPerUnit(Map.of())
                    .satisfied(false)
                    .reason(e.getMessage())
                    .build());
                continue;
            }
            current = applyConstraint(i, constraint, current, diagnostics, exclusions);
        }
        
        List<String> selected = current.stream()
            .map(ClusterDescriptor::getName)
            .distinct()
            .sorted()
            .collect(Collectors.toList());
        
        log.info("Placement resolved to {} clusters ({} candidates, {} eligible, {} spread constraints)", 
                selected.size(), clusters.size(), eligible.size(), constraints.size());
        
        return PlacementResult.builder()
            .selectedClusters(selected)
            .constraintDiagnostics(diagnostics)
            .exclusions(exclusions)
            .build();
    }
    
    private List<ClusterDescriptor> filterClusters(Placement placement, List<ClusterDescriptor> clusters,
                                                   List<ClusterExclusion> exclusions) {
        Optional<ClusterAffinity> affinity = placement.findClusterAffinity();
        List<Toleration> tolerations = placement.getClusterTolerations() != null 
            ? placement.getClusterTolerations() : List.of();
        
        List<ClusterDescriptor> eligible = new ArrayList<>();
        for (ClusterDescriptor cluster : clusters) {
            ClusterFilter.FilterOutcome outcome = clusterFilter.evaluate(cluster, affinity, tolerations);
            if (outcome.isEligible()) {
                eligible.add(cluster);
            } else {
                exclusions.add(ClusterExclusion.builder()
                    .cluster(cluster.getName())
                    .stage(ExclusionStage.CLUSTER_FILTER)
                    .reason("rejected by " + outcome.getRejectedBy())
                    .build());
            }
        }
        return eligible;
    }
    
    private List<ClusterDescriptor> applyConstraint(int index, SpreadConstraint constraint,
                                                    List<ClusterDescriptor> current,
                                                    List<ConstraintDiagnostic> diagnostics,
                                                    List<ClusterExclusion> exclusions) {
        SortedMap<String, List<ClusterDescriptor>> units = spreadGrouper.group(current, constraint);
        UnitSelection selection = unitSelector.selectUnits(units, constraint.getMinimum(), constraint.getMaximum());
        Set<String> selectedUnits = new HashSet<>(selection.getSelectedUnits());
        
        List<ClusterDescriptor> narrowed = new ArrayList<>();
        units.forEach((unit, members) -> {
            if (selectedUnits.contains(unit)) {
                narrowed.addAll(members);
                return;
            }
            String reason = unit.equals(EMPTY_UNIT_KEY)
                ? "no value for " + SpreadGrouper.describe(constraint) + " and the empty-key unit was not selected"
                : "unit '" + unit + "' of " + SpreadGrouper.describe(constraint) + " was not selected";
            for (ClusterDescriptor member : members) {
                exclusions.add(ClusterExclusion.builder()
                    .cluster(member.getName())
                    .stage(ExclusionStage.SPREAD_CONSTRAINT)
                    .constraintIndex(index)
                    .reason(reason)
                    .build());
            }
        });
        
        String reason = null;
        if (!selection.isSatisfied()) {
            reason = "only " + selection.getUnitsFound() + " units available by " + SpreadGrouper.describe(constraint)
                + ", minimum is " + constraint.getMinimum();
        }
        
        diagnostics.add(ConstraintDiagnostic.builder()
            .constraintIndex(index)
            .unitsFound(selection.getUnitsFound())
            .unitsSelected(selection.getSelectedUnits().size())
            .selectedUnits(selection.getSelectedUnits())
            .clustersPerUnit(selection.getClustersPerUnit())
            .satisfied(selection.isSatisfied())
            .reason(reason)
            .build());
        
        log.debug("Spread constraint #{} by {} kept {} of {} clusters", 
                 index, SpreadGrouper.describe(constraint), narrowed.size(), current.size());
        return narrowed;
    }
}
