package io.propagationcontroller.selector;

import io.propagationcontroller.enums.SelectorOperator;
import io.propagationcontroller.models.LabelSelector;
import io.propagationcontroller.models.LabelSelectorRequirement;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates selector requirements against a key-value mapping (labels or cluster fields).
 * 
 * Operators:
 * - In: key present and value in values
 * - NotIn: key absent, or value not in values
 * - Exists / DoesNotExist: key presence
 * - Gt / Lt: key present, value and the single requirement value parse as integers, and compare
 * 
 * Malformed requirements (unknown operator, In/NotIn/Gt/Lt without values) evaluate to false.
 */
@Slf4j
public final class LabelSelectorMatcher {
    
    private LabelSelectorMatcher() {
        // Utility class
    }
    
    /**
     * Match a label selector against labels. matchLabels and matchExpressions are ANDed
     * and an empty selector matches everything. Gt and Lt are not label operators and never match here.
     * 
     * @param selector the selector, must not be null
     * @param labels labels of the object, null is treated as no labels
     */
    public static boolean matches(LabelSelector selector, Map<String, String> labels) {
        Map<String, String> source = labels != null ? labels : Map.of();
        
        if (selector.getMatchLabels() != null) {
            for (Map.Entry<String, String> entry : selector.getMatchLabels().entrySet()) {
                if (!source.containsKey(entry.getKey()) || !Objects.equals(entry.getValue(), source.get(entry.getKey()))) {
                    return false;
                }
            }
        }
        
        if (selector.getMatchExpressions() != null) {
            for (LabelSelectorRequirement requirement : selector.getMatchExpressions()) {
                SelectorOperator operator = requirement.getOperator();
                if (operator == SelectorOperator.GT || operator == SelectorOperator.LT) {
                    log.debug("Operator {} is not supported in label selectors (key={})", operator, requirement.getKey());
                    return false;
                }
                if (!matchesRequirement(requirement.getKey(), operator, requirement.getValues(), source)) {
                    return false;
                }
            }
        }
        
        return true;
    }
    
    /**
     * Evaluate a single requirement against a key-value mapping.
     */
    public static boolean matchesRequirement(String key, SelectorOperator operator, List<String> values,
                                             Map<String, String> source) {
        if (operator == null || key == null) {
            return false;
        }
        
        boolean present = source.containsKey(key) && source.get(key) != null;
        String actual = present ? source.get(key) : null;
        
        switch (operator) {
            case IN:
                return hasValues(values) && present && values.contains(actual);
            case NOT_IN:
                return hasValues(values) && (!present || !values.contains(actual));
            case EXISTS:
                return present;
            case DOES_NOT_EXIST:
                return !present;
            case GT:
            case LT:
                return present && compareNumeric(operator, actual, values);
            default:
                return false;
        }
    }
    
    private static boolean compareNumeric(SelectorOperator operator, String actual, List<String> values) {
        if (values == null || values.size() != 1) {
            return false;
        }
        try {
            long left = Long.parseLong(actual.trim());
            long right = Long.parseLong(values.get(0).trim());
            return operator == SelectorOperator.GT ? left > right : left < right;
        } catch (NumberFormatException e) {
            log.debug("Non-numeric operand for {} ({} vs {}), requirement does not match", operator, actual, values);
            return false;
        }
    }
    
    private static boolean hasValues(List<String> values) {
        return values != null && !values.isEmpty();
    }
}
