package io.propagationcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Optional;

/**
 * Rules for selecting the clusters resources are propagated to.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Placement {
    
    /**
     * If not set, any cluster is a candidate.
     */
    @JsonProperty("clusterAffinity")
    private ClusterAffinity clusterAffinity;
    
    @JsonProperty("clusterTolerations")
    private List<Toleration> clusterTolerations;
    
    /**
     * Applied in list order, each one narrowing the result of the previous one.
     */
    @JsonProperty("spreadConstraints")
    private List<SpreadConstraint> spreadConstraints;
    
    public Optional<ClusterAffinity> findClusterAffinity() {
        return Optional.ofNullable(clusterAffinity);
    }
}
