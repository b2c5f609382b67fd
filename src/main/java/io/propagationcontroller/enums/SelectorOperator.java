package io.propagationcontroller.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Operators accepted in label and field selector requirements.
 * 
 * GT and LT are only meaningful for field selectors; label selectors reject them.
 */
public enum SelectorOperator {
    IN("In"),
    NOT_IN("NotIn"),
    EXISTS("Exists"),
    DOES_NOT_EXIST("DoesNotExist"),
    GT("Gt"),
    LT("Lt");
    
    private final String value;
    
    SelectorOperator(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    /**
     * Parse an operator name. Matching is case-insensitive.
     * 
     * @return the operator, or null for an unknown name
     */
    @JsonCreator
    public static SelectorOperator fromString(String value) {
        if (value == null) return null;
        
        String trimmed = value.trim();
        for (SelectorOperator operator : values()) {
            if (operator.value.equalsIgnoreCase(trimmed) || operator.name().equalsIgnoreCase(trimmed)) {
                return operator;
            }
        }
        return null;
    }
}
