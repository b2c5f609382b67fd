package io.propagationcontroller.placement;

import io.propagationcontroller.models.ClusterDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Ranks units by descending score. Equal scores fall back to ascending unit key.
 */
@Slf4j
public class ScoredUnitRankingStrategy implements UnitRankingStrategy {
    
    private final UnitScorer scorer;
    private final String name;
    
    public ScoredUnitRankingStrategy(UnitScorer scorer, String name) {
        this.scorer = scorer;
        this.name = name;
    }
    
    @Override
    public List<String> rankUnits(SortedMap<String, List<ClusterDescriptor>> units) {
        Map<String, Double> scores = new HashMap<>();
        units.forEach((key, clusters) -> scores.put(key, scorer.score(key, clusters)));
        
        List<String> ranked = new ArrayList<>(units.keySet());
        ranked.sort(Comparator.comparing((String key) -> scores.get(key)).reversed()
            .thenComparing(Comparator.naturalOrder()));
        
        log.trace("{} ranking: {} (scores={})", name, ranked, scores);
        return ranked;
    }
    
    @Override
    public String getStrategyName() {
        return name;
    }
}
