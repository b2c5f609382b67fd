package io.propagationcontroller.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Outcome of selecting cluster units for one spread constraint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UnitSelection {
    
    /**
     * Number of units the constraint grouped the clusters into
     */
    private int unitsFound;
    
    /**
     * Selected unit keys, in selection order
     */
    private List<String> selectedUnits;
    
    /**
     * Number of usable clusters in each selected unit
     */
    private Map<String, Integer> clustersPerUnit;
    
    /**
     * false when the minimum number of units could not be reached
     */
    private boolean satisfied;
}
