package io.propagationcontroller.placement;

/**
 * Thrown for a structurally invalid spread constraint. The resolver skips the
 * offending constraint and keeps evaluating the others.
 */
public class InvalidSpreadConstraintException extends IllegalArgumentException {
    
    private final int constraintIndex;
    
    public InvalidSpreadConstraintException(int constraintIndex, String message) {
        super("Invalid spread constraint #" + constraintIndex + ": " + message);
        this.constraintIndex = constraintIndex;
    }
    
    public int getConstraintIndex() {
        return constraintIndex;
    }
}
