package io.propagationcontroller.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Taint effects. PREFER_NO_SCHEDULE is a soft preference and is ignored by the cluster filter.
 * An unrecognized effect parses to null and is treated as blocking.
 */
public enum TaintEffect {
    NO_SCHEDULE("NoSchedule"),
    PREFER_NO_SCHEDULE("PreferNoSchedule"),
    NO_EXECUTE("NoExecute");
    
    private final String value;
    
    TaintEffect(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    public boolean isBlocking() {
        return this == NO_SCHEDULE || this == NO_EXECUTE;
    }
    
    @JsonCreator
    public static TaintEffect fromString(String value) {
        if (value == null || value.isBlank()) return null;
        
        String trimmed = value.trim();
        for (TaintEffect effect : values()) {
            if (effect.value.equalsIgnoreCase(trimmed)) {
                return effect;
            }
        }
        return null;
    }
}
