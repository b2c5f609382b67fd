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
 * A key, an operator and a set of values. In and NotIn use the values; Exists and DoesNotExist ignore them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LabelSelectorRequirement {
    
    @JsonProperty("key")
    private String key;
    
    @JsonProperty("operator")
    private SelectorOperator operator;
    
    @JsonProperty("values")
    private List<String> values;
}
