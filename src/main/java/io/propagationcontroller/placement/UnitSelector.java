package io.propagationcontroller.placement;

import io.propagationcontroller.models.ClusterDescriptor;
import io.propagationcontroller.models.UnitSelection;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static io.propagationcontroller.config.Constants.EMPTY_UNIT_KEY;

/**
 * Selects cluster units under a constraint's minimum/maximum bounds.
 * 
 * Decision logic, with U = number of candidate units:
 * - maximum > 0: the first min(U, maximum) units of the ranking are selected
 * - maximum = 0: every unit is selected
 * - minimum > 0 and U < minimum: every unit is kept and the selection is reported unsatisfied
 * 
 * The empty-key unit (clusters lacking the spread field or label) is a candidate
 * unless countEmptyKeyUnit is false, in which case it is never selected.
 */
@Slf4j
public class UnitSelector {
    
    private final UnitRankingStrategy rankingStrategy;
    private final boolean countEmptyKeyUnit;
    
    public UnitSelector() {
        this(new LexicographicUnitRankingStrategy(), true);
    }
    
    public UnitSelector(UnitRankingStrategy rankingStrategy, boolean countEmptyKeyUnit) {
        this.rankingStrategy = rankingStrategy;
        this.countEmptyKeyUnit = countEmptyKeyUnit;
    }
    
    /**
     * Select units from the grouped clusters.
     * 
     * @param groups units keyed by unit key
     * @param minimum minimum number of units, 0 for no floor
     * @param maximum maximum number of units, 0 for unbounded
     * @return the selected unit keys, cluster counts per selected unit and whether the minimum was met
     */
    public UnitSelection selectUnits(SortedMap<String, List<ClusterDescriptor>> groups, int minimum, int maximum) {
        SortedMap<String, List<ClusterDescriptor>> candidates = new TreeMap<>(groups);
        if (!countEmptyKeyUnit && candidates.remove(EMPTY_UNIT_KEY) != null) {
            log.debug("Empty-key unit is not counted, dropping it from the candidates");
        }
        
        int unitsFound = candidates.size();
        List<String> ranked = rankingStrategy.rankUnits(candidates);
        
        List<String> selected = maximum > 0 && ranked.size() > maximum
            ? List.copyOf(ranked.subList(0, maximum))
            : List.copyOf(ranked);
        
        boolean satisfied = minimum <= 0 || unitsFound >= minimum;
        if (!satisfied) {
            log.info("Only {} units available but minimum is {}, keeping all of them", unitsFound, minimum);
        }
        
        Map<String, Integer> clustersPerUnit = new LinkedHashMap<>();
        for (String unit : selected) {
            clustersPerUnit.put(unit, candidates.get(unit).size());
        }
        
        log.debug("{} ranking selected {} of {} units (min={}, max={}): {}", 
                 rankingStrategy.getStrategyName(), selected.size(), unitsFound, minimum, maximum,
                 selected.stream().map(u -> u.isEmpty() ? "<empty>" : u).collect(Collectors.joining(", ")));
        
        return UnitSelection.builder()
            .unitsFound(unitsFound)
            .selectedUnits(selected)
            .clustersPerUnit(clustersPerUnit)
            .satisfied(satisfied)
            .build();
    }
    
    public String getStrategyName() {
        return rankingStrategy.getStrategyName();
    }
}
