package com.podmachine.machine;

/**
 * What converging a {@link DesiredObjectSet} should achieve.
 */
public enum ConvergeIntent {
    /** Create or update every object in the set, then delete owned objects outside it. */
    APPLY,
    /** Apply nothing; delete every object owned for the set's workload. */
    PRUNE_TO_EMPTY
}
