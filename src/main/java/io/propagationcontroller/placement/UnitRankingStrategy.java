package io.propagationcontroller.placement;

import io.propagationcontroller.models.ClusterDescriptor;

import java.util.List;
import java.util.SortedMap;

/**
 * Strategy interface for ordering cluster units by preference.
 * 
 * The UnitSelector takes units from the front of the ranking until the
 * constraint's maximum is reached. Implementations must be deterministic.
 * 
 * Implementations:
 * - LexicographicUnitRankingStrategy: ascending unit key (default)
 * - ScoredUnitRankingStrategy: descending score from a pluggable UnitScorer
 */
public interface UnitRankingStrategy {
    
    /**
     * Rank units, most preferred first.
     * 
     * @param units units keyed by unit key, in lexicographic order
     * @return every unit key of {@code units}, most preferred first
     */
    List<String> rankUnits(SortedMap<String, List<ClusterDescriptor>> units);
    
    /**
     * Get the name of this strategy (for logging).
     */
    String getStrategyName();
}
