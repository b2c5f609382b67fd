package io.propagationcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Label query. matchLabels and matchExpressions are ANDed; an empty selector matches everything.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public class LabelSelector {
    
    @JsonProperty("matchLabels")
    private Map<String, String> matchLabels;
    
    @JsonProperty("matchExpressions")
    private List<LabelSelectorRequirement> matchExpressions;
    
    @JsonIgnore
    public boolean isEmpty() {
        return (matchLabels == null || matchLabels.isEmpty())
            && (matchExpressions == null || matchExpressions.isEmpty());
    }
}
