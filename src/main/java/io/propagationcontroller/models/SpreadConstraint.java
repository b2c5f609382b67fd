package io.propagationcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Groups eligible clusters into units and bounds how many units are selected.
 * 
 * Exactly one of spreadByField and spreadByLabel must be set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_DEFAULT)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SpreadConstraint {
    
    /**
     * Cluster field used for grouping: region, zone, cluster or provider.
     */
    @JsonProperty("spreadByField")
    private String spreadByField;
    
    /**
     * Cluster label key used for grouping.
     */
    @JsonProperty("spreadByLabel")
    private String spreadByLabel;
    
    /**
     * Maximum number of units to select, 0 means unbounded.
     */
    @JsonProperty("maximum")
    private int maximum;
    
    /**
     * Minimum number of units to select, 0 means no floor.
     */
    @JsonProperty("minimum")
    private int minimum;
    
    public boolean hasSpreadByField() {
        return spreadByField != null && !spreadByField.isEmpty();
    }
    
    public boolean hasSpreadByLabel() {
        return spreadByLabel != null && !spreadByLabel.isEmpty();
    }
}
