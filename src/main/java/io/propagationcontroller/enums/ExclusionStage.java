package io.propagationcontroller.enums;

/**
 * Placement stage at which a cluster was dropped from the candidate set.
 */
public enum ExclusionStage {
    CLUSTER_FILTER,
    SPREAD_CONSTRAINT
}
