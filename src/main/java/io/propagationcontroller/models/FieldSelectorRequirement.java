package io.propagationcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.propagationcontroller.enums.SelectorOperator;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Requirement on a cluster field (region, zone, cluster or provider).
 * Gt and Lt expect a single integer value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FieldSelectorRequirement {
    
    @JsonProperty("key")
    private String key;
    
    @JsonProperty("operator")
    private SelectorOperator operator;
    
    @JsonProperty("values")
    private List<String> values;
}
