package io.propagationcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Clusters selected for a policy, with diagnostics. An empty selection is a valid result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlacementResult {
    
    /**
     * Selected cluster names in lexicographic order
     */
    @JsonProperty("selectedClusters")
    private List<String> selectedClusters;
    
    @JsonProperty("constraintDiagnostics")
    private List<ConstraintDiagnostic> constraintDiagnostics;
    
    @JsonProperty("exclusions")
    private List<ClusterExclusion> exclusions;
    
    @JsonIgnore
    public boolean isAllConstraintsSatisfied() {
        return constraintDiagnostics == null
            || constraintDiagnostics.stream().allMatch(ConstraintDiagnostic::isSatisfied);
    }
    
    public static PlacementResult empty() {
        return PlacementResult.builder()
            .selectedClusters(List.of())
            .constraintDiagnostics(List.of())
            .exclusions(List.of())
            .build();
    }
}
