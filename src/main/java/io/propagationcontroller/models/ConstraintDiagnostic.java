package io.propagationcontroller.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Per spread constraint outcome of a placement resolution.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConstraintDiagnostic {
    
    @JsonProperty("constraintIndex")
    private int constraintIndex;
    
    @JsonProperty("unitsFound")
    private int unitsFound;
    
    @JsonProperty("unitsSelected")
    private int unitsSelected;
    
    @JsonProperty("selectedUnits")
    private List<String> selectedUnits;
    
    @JsonProperty("clustersPerUnit")
    private Map<String, Integer> clustersPerUnit;
    
    @JsonProperty("satisfied")
    private boolean satisfied;
    
    /**
     * Why the constraint was skipped or not satisfied, null when satisfied
     */
    @JsonProperty("reason")
    private String reason;
}
