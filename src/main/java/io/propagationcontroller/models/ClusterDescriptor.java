package io.propagationcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Snapshot of a member cluster from the cluster inventory.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClusterDescriptor {
    
    @JsonProperty("name")
    private String name;
    
    @JsonProperty("labels")
    private Map<String, String> labels;
    
    @JsonProperty("provider")
    private String provider;
    
    @JsonProperty("region")
    private String region;
    
    @JsonProperty("zone")
    private String zone;
    
    @JsonProperty("taints")
    private List<Taint> taints;
}
