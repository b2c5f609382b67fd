package io.propagationcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Policy that propagates a group of resources to one or more clusters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PropagationPolicy {
    
    @JsonProperty("apiVersion")
    private String apiVersion;
    
    @JsonProperty("kind")
    private String kind;
    
    @JsonProperty("metadata")
    private PolicyMetadata metadata;
    
    @JsonProperty("spec")
    private PropagationSpec spec;
    
    /**
     * @return namespace/name, or just name for a policy without namespace
     */
    public String qualifiedName() {
        if (metadata == null || metadata.getName() == null) {
            return "<unnamed>";
        }
        String namespace = metadata.getNamespace();
        return namespace == null || namespace.isEmpty()
            ? metadata.getName()
            : namespace + "/" + metadata.getName();
    }
}
