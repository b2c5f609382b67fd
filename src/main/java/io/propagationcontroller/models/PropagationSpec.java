package io.propagationcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Desired behavior of a propagation policy.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PropagationSpec {
    
    /**
     * Selectors used to select resources. null selects all resources, an empty list selects none.
     */
    @JsonProperty("resourceSelector")
    private List<ResourceSelector> resourceSelectors;
    
    /**
     * Whether referenced resources (e.g. a ConfigMap used by a Deployment) should be selected too.
     */
    @JsonProperty("association")
    private boolean association;
    
    @JsonProperty("placement")
    private Placement placement;
    
    /**
     * Scheduler in charge of the policy. Empty means the default scheduler.
     */
    @JsonProperty("schedulerName")
    private String schedulerName;
}
