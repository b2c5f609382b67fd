package io.propagationcontroller.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * What to propagate and where, as consumed by the dispatcher.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PropagationDecision {
    
    @JsonProperty("policyName")
    private String policyName;
    
    @JsonProperty("policyNamespace")
    private String policyNamespace;
    
    /**
     * false when the policy is owned by another scheduler and was left alone
     */
    @JsonProperty("scheduled")
    private boolean scheduled;
    
    @JsonProperty("matchedResources")
    private List<ResourceDescriptor> matchedResources;
    
    @JsonProperty("placement")
    private PlacementResult placement;
}
