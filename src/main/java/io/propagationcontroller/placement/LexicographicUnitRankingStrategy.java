package io.propagationcontroller.placement;

import io.propagationcontroller.models.ClusterDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;

/**
 * Ranks units by ascending unit key.
 */
public class LexicographicUnitRankingStrategy implements UnitRankingStrategy {
    
    @Override
    public List<String> rankUnits(SortedMap<String, List<ClusterDescriptor>> units) {
        return new ArrayList<>(units.keySet());
    }
    
    @Override
    public String getStrategyName() {
        return "Lexicographic";
    }
}
