package io.propagationcontroller.placement;

import io.propagationcontroller.models.SpreadConstraint;

/**
 * Structural checks on spread constraints.
 */
public final class SpreadConstraintValidator {
    
    private SpreadConstraintValidator() {
        // Utility class
    }
    
    /**
     * Validate a spread constraint.
     * 
     * @param index position of the constraint in the policy, used in the error message
     * @param constraint the constraint to check
     * @throws InvalidSpreadConstraintException if both or neither of spreadByField and spreadByLabel
     *         are set, a bound is negative, or minimum exceeds maximum while both are set
     */
    public static void validate(int index, SpreadConstraint constraint) {
        if (constraint == null) {
            throw new InvalidSpreadConstraintException(index, "constraint is null");
        }
        if (constraint.hasSpreadByField() && constraint.hasSpreadByLabel()) {
            throw new InvalidSpreadConstraintException(index, "spreadByField and spreadByLabel are mutually exclusive");
        }
        if (!constraint.hasSpreadByField() && !constraint.hasSpreadByLabel()) {
            throw new InvalidSpreadConstraintException(index, "one of spreadByField or spreadByLabel is required");
        }
        if (constraint.getMinimum() < 0) {
            throw new InvalidSpreadConstraintException(index, "minimum must not be negative, got " + constraint.getMinimum());
        }
        if (constraint.getMaximum() < 0) {
            throw new InvalidSpreadConstraintException(index, "maximum must not be negative, got " + constraint.getMaximum());
        }
        if (constraint.getMinimum() > 0 && constraint.getMaximum() > 0
            && constraint.getMinimum() > constraint.getMaximum()) {
            throw new InvalidSpreadConstraintException(index, "minimum " + constraint.getMinimum()
                + " is greater than maximum " + constraint.getMaximum());
        }
    }
}
