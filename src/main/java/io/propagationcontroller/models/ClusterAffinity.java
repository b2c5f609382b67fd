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
 * Filter to select member clusters. A cluster listed in {@link #excludeClusters} is never eligible.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClusterAffinity {
    
    @JsonProperty("labelSelector")
    private LabelSelector labelSelector;
    
    @JsonProperty("fieldSelector")
    private FieldSelector fieldSelector;
    
    @JsonProperty("clusterNames")
    private List<String> clusterNames;
    
    @JsonProperty("exclude")
    private List<String> excludeClusters;
    
    public Optional<LabelSelector> findLabelSelector() {
        return Optional.ofNullable(labelSelector);
    }
    
    public Optional<FieldSelector> findFieldSelector() {
        return Optional.ofNullable(fieldSelector);
    }
}
