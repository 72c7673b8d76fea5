package com.archcodex.core.model;

/**
 * How a multi-valued constraint is satisfied.
 */
public enum MatchMode {
    /** Every listed value must be satisfied */
    ALL,
    /** At least one listed value must be satisfied */
    ANY
}
