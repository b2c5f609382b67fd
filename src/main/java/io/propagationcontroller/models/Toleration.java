package io.propagationcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.propagationcontroller.enums.TaintEffect;
import io.propagationcontroller.enums.TolerationOperator;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Objects;

/**
 * Toleration declared by a policy placement.
 * 
 * Matching rules:
 * - effect unset tolerates every effect, otherwise effects must be equal
 * - operator Exists with an empty key tolerates every taint
 * - operator Exists with a key tolerates any value for that key
 * - operator Equal (or unset) requires equal values, plus equal keys when the key is set
 * - an unrecognized operator tolerates nothing
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Toleration {
    
    @JsonProperty("key")
    private String key;
    
    @JsonProperty("operator")
    private TolerationOperator operator;
    
    @JsonProperty("value")
    private String value;
    
    @JsonProperty("effect")
    private TaintEffect effect;
    
    @JsonProperty("tolerationSeconds")
    private Long tolerationSeconds;
    
    public boolean tolerates(Taint taint) {
        if (effect != null && effect != taint.getEffect()) {
            return false;
        }
        
        boolean emptyKey = key == null || key.isEmpty();
        if (!emptyKey && !key.equals(taint.getKey())) {
            return false;
        }
        
        TolerationOperator op = operator != null ? operator : TolerationOperator.EQUAL;
        switch (op) {
            case EXISTS:
                return true;
            case EQUAL:
                return Objects.equals(nullToEmpty(value), nullToEmpty(taint.getValue()));
            default:
                return false;
        }
    }
    
    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
