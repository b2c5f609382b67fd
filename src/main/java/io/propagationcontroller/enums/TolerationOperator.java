package io.propagationcontroller.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Toleration operators. An unset or blank operator behaves as EQUAL.
 * Any other unrecognized name parses to UNSUPPORTED, which tolerates nothing.
 */
public enum TolerationOperator {
    EQUAL("Equal"),
    EXISTS("Exists"),
    UNSUPPORTED("Unsupported");
    
    private final String value;
    
    TolerationOperator(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    @JsonCreator
    public static TolerationOperator fromString(String value) {
        if (value == null || value.isBlank()) return EQUAL;
        
        switch (value.trim().toUpperCase()) {
            case "EQUAL":
                return EQUAL;
            case "EXISTS":
                return EXISTS;
            default:
                return UNSUPPORTED;
        }
    }
}
