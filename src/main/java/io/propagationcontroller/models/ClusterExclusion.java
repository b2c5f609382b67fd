package io.propagationcontroller.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.propagationcontroller.enums.ExclusionStage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Why a candidate cluster did not make it into the placement.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClusterExclusion {
    
    @JsonProperty("cluster")
    private String cluster;
    
    @JsonProperty("stage")
    private ExclusionStage stage;
    
    /**
     * Index of the spread constraint that dropped the cluster, null for the cluster filter stage
     */
    @JsonProperty("constraintIndex")
    private Integer constraintIndex;
    
    @JsonProperty("reason")
    private String reason;
}
