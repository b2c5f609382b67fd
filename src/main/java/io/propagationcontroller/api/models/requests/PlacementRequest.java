package io.propagationcontroller.api.models.requests;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.propagationcontroller.models.ClusterDescriptor;
import io.propagationcontroller.models.PropagationPolicy;
import io.propagationcontroller.models.ResourceDescriptor;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request to resolve one policy against inventory snapshots.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlacementRequest {
    
    @JsonProperty("policy")
    private PropagationPolicy policy;
    
    @JsonProperty("clusters")
    private List<ClusterDescriptor> clusters;
    
    @JsonProperty("resources")
    private List<ResourceDescriptor> resources;
}
