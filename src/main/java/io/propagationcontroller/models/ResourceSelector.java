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
 * Selects resources by API version, kind, name, namespace and labels.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResourceSelector {
    
    /**
     * API version of the target resources. Required, matched exactly.
     */
    @JsonProperty("apiVersion")
    private String apiVersion;
    
    /**
     * Kind of the target resources. Required, matched exactly.
     */
    @JsonProperty("kind")
    private String kind;
    
    /**
     * Names to select. Empty selects every name.
     */
    @JsonProperty("names")
    private List<String> names;
    
    /**
     * Namespaces to select. Empty selects every namespace.
     */
    @JsonProperty("namespaces")
    private List<String> namespaces;
    
    /**
     * Namespaces to ignore, applied after {@link #namespaces}.
     */
    @JsonProperty("excludeNamespaces")
    private List<String> excludeNamespaces;
    
    @JsonProperty("labelSelector")
    private LabelSelector labelSelector;
    
    public Optional<LabelSelector> findLabelSelector() {
        return Optional.ofNullable(labelSelector);
    }
}
