package io.propagationcontroller.enums;

/**
 * Placement decision returned by a cluster decider.
 */
public enum Decision {
    YES, NO
}
